package com.github.anirbanmu.kookbridge.kook;

public class KookApiException extends RuntimeException {
    private final int code;

    public KookApiException(String message, int code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public int code() {
        return code;
    }
}
