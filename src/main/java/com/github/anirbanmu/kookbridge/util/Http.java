package com.github.anirbanmu.kookbridge.util;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.Executors;

public final class Http {
    public static final Duration CONNECT_TIMEOUT = Duration.ofMillis(2500);

    // shared by the rest client and every gateway socket
    public static final HttpClient CLIENT = HttpClient.newBuilder()
        .executor(Executors.newCachedThreadPool(Threads.daemonFactory("kook-http")))
        .connectTimeout(CONNECT_TIMEOUT)
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();

    private Http() {
    }
}
