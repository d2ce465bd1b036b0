package com.github.anirbanmu.kookbridge.kook;

import static org.junit.jupiter.api.Assertions.*;

import com.github.anirbanmu.kookbridge.inbound.EventAdmission;
import com.github.anirbanmu.kookbridge.testing.FakeConnector;
import com.github.anirbanmu.kookbridge.testing.FakeKookApi;
import com.github.anirbanmu.kookbridge.testing.Wait;
import com.github.anirbanmu.kookbridge.util.Threads;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class PersistentGatewayTest {
    private static final GatewayTimings FAST = new GatewayTimings(
        Duration.ofSeconds(2), Duration.ofSeconds(30), Duration.ofMillis(10), Duration.ofMillis(40));

    private final FakeKookApi api = new FakeKookApi();
    private final FakeConnector connector = new FakeConnector();
    private final Cancellation cancellation = new Cancellation();
    private final List<String> handled = new CopyOnWriteArrayList<>();
    private final EventAdmission admission = new EventAdmission("default",
        (event, botId) -> handled.add(event.content() + "@" + botId), Executors.newSingleThreadExecutor());

    @AfterEach
    void tearDown() {
        cancellation.cancel();
        admission.shutdown(Duration.ofSeconds(1));
    }

    private CompletableFuture<Void> start(PersistentGateway gateway) {
        return CompletableFuture.runAsync(() -> gateway.run(cancellation),
            Executors.newSingleThreadExecutor(Threads.daemonFactory("test-supervisor")));
    }

    private static String event(int sn, String author, String content) {
        return """
            {"s":0,"sn":%d,"d":{"channel_type":"GROUP","type":1,"target_id":"chan-1","author_id":"%s",
            "content":"%s","msg_id":"m%d","msg_timestamp":1}}
            """.formatted(sn, author, content, sn);
    }

    @Test
    void lostConnectionResumesWithoutReprobing() throws Exception {
        PersistentGateway gateway = new PersistentGateway("default", api, connector, FAST, admission);
        CompletableFuture<Void> done = start(gateway);

        FakeConnector.Connection first = connector.awaitConnection(0);
        assertFalse(gateway.isHealthy());
        first.hello("session-1");
        Wait.until(gateway::isHealthy, "first session live");
        assertEquals("bot-1", gateway.botId());
        first.send(event(3, "u1", "hello"));
        first.close(1006, "gone");

        FakeConnector.Connection second = connector.awaitConnection(1);
        assertTrue(second.uri().toString().endsWith("&resume=1&sn=3&session_id=session-1"), second.uri().toString());
        assertEquals(1, gateway.reconnectState().attemptCount());
        assertEquals(10, gateway.reconnectState().nextWaitMs());

        second.hello("session-1");
        Wait.until(gateway::isHealthy, "resumed session live");
        assertEquals(0, gateway.reconnectState().attemptCount());
        assertEquals(1, api.selfCalls.get());
        assertEquals(2, api.gatewayCalls.get());

        cancellation.cancel();
        done.get(5, TimeUnit.SECONDS);
        assertFalse(gateway.isHealthy());
        Wait.until(() -> handled.size() == 1, "event handled");
        assertEquals(List.of("hello@bot-1"), handled);
    }

    @Test
    void serverResetStartsFreshAndReprobes() throws Exception {
        PersistentGateway gateway = new PersistentGateway("default", api, connector, FAST, admission);
        CompletableFuture<Void> done = start(gateway);

        FakeConnector.Connection first = connector.awaitConnection(0);
        first.hello("session-1");
        first.send("{\"s\":5,\"d\":{\"code\":41008,\"err\":\"Missing params\"}}");

        FakeConnector.Connection second = connector.awaitConnection(1);
        assertEquals(FakeKookApi.GATEWAY_URL, second.uri().toString());
        assertEquals(2, api.selfCalls.get());

        cancellation.cancel();
        done.get(5, TimeUnit.SECONDS);
    }

    @Test
    void backoffGrowsWhileConnectionsFail() throws Exception {
        connector.refuse = true;
        PersistentGateway gateway = new PersistentGateway("default", api, connector, FAST, admission);
        CompletableFuture<Void> done = start(gateway);

        connector.awaitConnection(3);
        Wait.until(() -> gateway.reconnectState().attemptCount() >= 4, "four failed attempts");
        assertEquals(40, gateway.reconnectState().nextWaitMs());

        cancellation.cancel();
        done.get(5, TimeUnit.SECONDS);
    }

    @Test
    void helloTimeoutBacksOffAndStartsFresh() throws Exception {
        GatewayTimings silent = new GatewayTimings(Duration.ofMillis(50), Duration.ofSeconds(30), Duration.ofMillis(300), Duration.ofMillis(600));
        PersistentGateway gateway = new PersistentGateway("default", api, connector, silent, admission);
        CompletableFuture<Void> done = start(gateway);

        FakeConnector.Connection first = connector.awaitConnection(0);
        Wait.until(() -> gateway.reconnectState().attemptCount() == 1, "first hello timeout");
        assertEquals(new PersistentGateway.ReconnectState(1, 300), gateway.reconnectState());
        assertTrue(first.socket().aborted);
        assertFalse(gateway.isHealthy());

        FakeConnector.Connection second = connector.awaitConnection(1);
        assertEquals(FakeKookApi.GATEWAY_URL, second.uri().toString());
        assertEquals(2, api.gatewayCalls.get());
        assertEquals(2, api.selfCalls.get());

        cancellation.cancel();
        done.get(5, TimeUnit.SECONDS);
    }

    @Test
    void selfEchoIsDroppedAndUnknownIdentityIsTolerated() throws Exception {
        PersistentGateway gateway = new PersistentGateway("default", api, connector, FAST, admission);
        CompletableFuture<Void> done = start(gateway);

        FakeConnector.Connection conn = connector.awaitConnection(0);
        conn.hello("session-1");
        conn.send(event(1, "bot-1", "echo"));
        conn.send(event(2, "u1", "real"));
        Wait.until(() -> handled.size() == 1, "real message handled");
        assertEquals(List.of("real@bot-1"), handled);

        cancellation.cancel();
        done.get(5, TimeUnit.SECONDS);
    }

    @Test
    void probeFailureLeavesBotIdUnknown() throws Exception {
        api.selfResult = new KookResult.Failure<>("unauthorized", 401);
        PersistentGateway gateway = new PersistentGateway("default", api, connector, FAST, admission);
        CompletableFuture<Void> done = start(gateway);

        FakeConnector.Connection conn = connector.awaitConnection(0);
        conn.hello("session-1");
        conn.send(event(1, "bot-1", "from bot"));
        Wait.until(() -> handled.size() == 1, "message handled without identity");
        assertEquals(List.of("from bot@null"), handled);
        assertNull(gateway.botId());

        cancellation.cancel();
        done.get(5, TimeUnit.SECONDS);
    }

    @Test
    void cancellationDuringBackoffStopsPromptly() throws Exception {
        GatewayTimings slow = new GatewayTimings(Duration.ofSeconds(2), Duration.ofSeconds(30), Duration.ofSeconds(30), Duration.ofSeconds(60));
        connector.refuse = true;
        PersistentGateway gateway = new PersistentGateway("default", api, connector, slow, admission);
        CompletableFuture<Void> done = start(gateway);

        connector.awaitConnection(0);
        Wait.until(() -> gateway.reconnectState().attemptCount() == 1, "first backoff");
        cancellation.cancel();

        done.get(5, TimeUnit.SECONDS);
        assertEquals(1, connector.connections.size());
    }
}
