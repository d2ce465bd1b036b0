package com.github.anirbanmu.kookbridge.testing;

import com.github.anirbanmu.kookbridge.kook.GatewayConnector;
import java.io.IOException;
import java.net.URI;
import java.net.http.WebSocket;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

// plays the server side of the gateway socket
public class FakeConnector implements GatewayConnector {
    public record Connection(URI uri, WebSocket.Listener listener, FakeWebSocket socket) {
        public void send(String text) {
            listener.onText(socket, text, true);
        }

        public void hello(String sessionId) {
            send("{\"s\":1,\"d\":{\"code\":0,\"session_id\":\"" + sessionId + "\"}}");
        }

        public void close(int code, String reason) {
            listener.onClose(socket, code, reason);
        }
    }

    public final List<Connection> connections = new CopyOnWriteArrayList<>();
    public volatile boolean refuse;

    @Override
    public CompletableFuture<WebSocket> open(URI uri, WebSocket.Listener listener) {
        if (refuse) {
            connections.add(new Connection(uri, listener, null));
            return CompletableFuture.failedFuture(new IOException("connection refused"));
        }
        FakeWebSocket socket = new FakeWebSocket();
        // open first so the session has the socket before a test can talk on it
        listener.onOpen(socket);
        connections.add(new Connection(uri, listener, socket));
        return CompletableFuture.completedFuture(socket);
    }

    public Connection awaitConnection(int index) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (connections.size() <= index) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("no connection #" + index + " after 5s, have " + connections.size());
            }
            Thread.sleep(5);
        }
        return connections.get(index);
    }
}
