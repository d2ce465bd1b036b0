package com.github.anirbanmu.kookbridge.host;

// handed to the host with each dispatched message; the host calls it once per reply it produces
@FunctionalInterface
public interface ReplyDispatcher {
    void deliver(String text);
}
