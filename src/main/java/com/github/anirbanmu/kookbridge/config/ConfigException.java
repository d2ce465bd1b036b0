package com.github.anirbanmu.kookbridge.config;

// bad or incomplete configuration. never retried.
public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }
}
