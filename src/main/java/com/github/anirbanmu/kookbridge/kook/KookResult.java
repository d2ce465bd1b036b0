package com.github.anirbanmu.kookbridge.kook;

public sealed interface KookResult<T> {
    record Success<T>(T value) implements KookResult<T> {
    }

    // code is the api's own code when it answered, -1 for transport failures
    record Failure<T>(String message, int code, Throwable exception) implements KookResult<T> {
        public Failure(String message) {
            this(message, -1, null);
        }

        public Failure(String message, Throwable exception) {
            this(message, -1, exception);
        }

        public Failure(String message, int code) {
            this(message, code, null);
        }
    }
}
