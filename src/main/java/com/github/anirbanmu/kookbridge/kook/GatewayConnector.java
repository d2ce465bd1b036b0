package com.github.anirbanmu.kookbridge.kook;

import com.github.anirbanmu.kookbridge.util.Http;
import java.net.URI;
import java.net.http.WebSocket;
import java.util.concurrent.CompletableFuture;

// opens the gateway socket. split out so tests can hand the session a fake socket.
@FunctionalInterface
public interface GatewayConnector {
    CompletableFuture<WebSocket> open(URI uri, WebSocket.Listener listener);

    static GatewayConnector websocket() {
        return (uri, listener) -> Http.CLIENT.newWebSocketBuilder()
            .connectTimeout(Http.CONNECT_TIMEOUT)
            .buildAsync(uri, listener);
    }
}
