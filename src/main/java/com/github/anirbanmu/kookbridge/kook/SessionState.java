package com.github.anirbanmu.kookbridge.kook;

public enum SessionState {
    DISCONNECTED,
    FETCHING_ENDPOINT,
    CONNECTING,
    AWAITING_HELLO,
    LIVE,
    CLOSING
}
