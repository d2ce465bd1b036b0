package com.github.anirbanmu.kookbridge.kook;

import static org.junit.jupiter.api.Assertions.*;

import com.github.anirbanmu.kookbridge.kook.json.EventData;
import com.github.anirbanmu.kookbridge.testing.FakeConnector;
import com.github.anirbanmu.kookbridge.testing.FakeKookApi;
import com.github.anirbanmu.kookbridge.testing.FakeWebSocket;
import com.github.anirbanmu.kookbridge.testing.Wait;
import com.github.anirbanmu.kookbridge.util.Threads;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class GatewayTest {
    private static final GatewayTimings FAST = new GatewayTimings(
        Duration.ofSeconds(2), Duration.ofMillis(40), Duration.ofMillis(10), Duration.ofMillis(50));

    private final FakeKookApi api = new FakeKookApi();
    private final FakeConnector connector = new FakeConnector();
    private final ScheduledExecutorService timers = Executors.newSingleThreadScheduledExecutor(Threads.daemonFactory("test-timer"));
    private final List<EventData> events = new CopyOnWriteArrayList<>();
    private final AtomicInteger liveCount = new AtomicInteger();
    private final Cancellation cancellation = new Cancellation();

    @AfterEach
    void tearDown() {
        cancellation.cancel();
        timers.shutdownNow();
    }

    private Gateway gateway(GatewayTimings timings, Gateway.ResumeState resume) {
        return new Gateway("default", api, connector, timings, timers, resume, events::add, liveCount::incrementAndGet);
    }

    private CompletableFuture<Gateway.Outcome> start(Gateway gateway) {
        return CompletableFuture.supplyAsync(() -> gateway.run(cancellation), Executors.newSingleThreadExecutor(Threads.daemonFactory("test-gateway")));
    }

    private static String event(int sn, String content) {
        return """
            {"s":0,"sn":%d,"d":{"channel_type":"GROUP","type":1,"target_id":"chan-1","author_id":"u1",
            "content":"%s","msg_id":"m%d","msg_timestamp":1,"extra":{"guild_id":"g1","mention":[]}}}
            """.formatted(sn, content, sn);
    }

    @Test
    void helloMakesTheSessionLiveAndStartsHeartbeats() throws Exception {
        Gateway gateway = gateway(FAST, Gateway.ResumeState.EMPTY);
        CompletableFuture<Gateway.Outcome> outcome = start(gateway);

        FakeConnector.Connection conn = connector.awaitConnection(0);
        assertEquals(FakeKookApi.GATEWAY_URL, conn.uri().toString());
        Wait.until(() -> gateway.state() == SessionState.AWAITING_HELLO, "awaiting hello");

        conn.hello("session-1");
        Wait.until(() -> gateway.state() == SessionState.LIVE, "live");
        assertTrue(gateway.reachedLive());
        assertEquals(1, liveCount.get());

        conn.send(event(1, "one"));
        conn.send(event(2, "two"));
        Wait.until(() -> conn.socket().sent.contains("{\"s\":2,\"sn\":2}"), "ping with latest sequence");
        assertEquals(List.of("one", "two"), events.stream().map(EventData::content).toList());

        cancellation.cancel();
        assertEquals(Gateway.Outcome.CANCELLED, outcome.get(5, TimeUnit.SECONDS));
        assertEquals(1000, conn.socket().closeCode);
        assertEquals(SessionState.DISCONNECTED, gateway.state());
        assertEquals(new Gateway.ResumeState("session-1", 2), gateway.resumeState());
    }

    @Test
    void missingHelloTimesOut() throws Exception {
        GatewayTimings impatient = new GatewayTimings(Duration.ofMillis(50), Duration.ofSeconds(30), Duration.ofMillis(10), Duration.ofMillis(50));
        Gateway gateway = gateway(impatient, Gateway.ResumeState.EMPTY);

        assertEquals(Gateway.Outcome.LOST, start(gateway).get(5, TimeUnit.SECONDS));
        assertFalse(gateway.reachedLive());
        assertTrue(connector.connections.get(0).socket().aborted);
    }

    @Test
    void cancellingWhileAwaitingHelloClosesTheSocket() throws Exception {
        Gateway gateway = gateway(FAST, Gateway.ResumeState.EMPTY);
        CompletableFuture<Gateway.Outcome> outcome = start(gateway);

        FakeConnector.Connection conn = connector.awaitConnection(0);
        Wait.until(() -> gateway.state() == SessionState.AWAITING_HELLO, "awaiting hello");
        cancellation.cancel();

        assertEquals(Gateway.Outcome.CANCELLED, outcome.get(5, TimeUnit.SECONDS));
        assertTrue(conn.socket().isClosed());
        assertFalse(gateway.reachedLive());
    }

    @Test
    void cancellingWhileConnectingClosesTheSocketThatOpens() throws Exception {
        FakeWebSocket socket = new FakeWebSocket();
        GatewayConnector cancelsMidConnect = (uri, listener) -> {
            cancellation.cancel();
            listener.onOpen(socket);
            return CompletableFuture.completedFuture(socket);
        };
        Gateway gateway = new Gateway("default", api, cancelsMidConnect, FAST, timers, Gateway.ResumeState.EMPTY, events::add, liveCount::incrementAndGet);

        assertEquals(Gateway.Outcome.CANCELLED, start(gateway).get(5, TimeUnit.SECONDS));
        assertTrue(socket.isClosed());
        assertEquals(SessionState.DISCONNECTED, gateway.state());
    }

    @Test
    void socketOpeningAfterTheSessionEndedIsAborted() throws Exception {
        AtomicReference<WebSocket.Listener> pending = new AtomicReference<>();
        GatewayConnector slow = (uri, listener) -> {
            pending.set(listener);
            cancellation.cancel();
            return new CompletableFuture<>();
        };
        Gateway gateway = new Gateway("default", api, slow, FAST, timers, Gateway.ResumeState.EMPTY, events::add, liveCount::incrementAndGet);
        assertEquals(Gateway.Outcome.CANCELLED, start(gateway).get(5, TimeUnit.SECONDS));

        FakeWebSocket late = new FakeWebSocket();
        pending.get().onOpen(late);
        assertTrue(late.aborted);
        assertTrue(late.sent.isEmpty());
    }

    @Test
    void rejectedHelloResetsTheSession() throws Exception {
        Gateway gateway = gateway(FAST, new Gateway.ResumeState("old-session", 9));
        CompletableFuture<Gateway.Outcome> outcome = start(gateway);

        FakeConnector.Connection conn = connector.awaitConnection(0);
        assertTrue(conn.uri().toString().contains("resume=1&sn=9&session_id=old-session"), conn.uri().toString());
        conn.send("{\"s\":1,\"d\":{\"code\":40106}}");

        assertEquals(Gateway.Outcome.RESET, outcome.get(5, TimeUnit.SECONDS));
        assertFalse(gateway.resumeState().canResume());
        assertEquals(0, gateway.resumeState().lastSequence());
        assertEquals(0, liveCount.get());
    }

    @Test
    void serverReconnectClearsSessionState() throws Exception {
        Gateway gateway = gateway(FAST, Gateway.ResumeState.EMPTY);
        CompletableFuture<Gateway.Outcome> outcome = start(gateway);

        FakeConnector.Connection conn = connector.awaitConnection(0);
        conn.hello("session-1");
        conn.send(event(5, "x"));
        conn.send("{\"s\":5,\"d\":{\"code\":41008,\"err\":\"Missing params\"}}");

        assertEquals(Gateway.Outcome.RESET, outcome.get(5, TimeUnit.SECONDS));
        assertEquals(Gateway.ResumeState.EMPTY, gateway.resumeState());
    }

    @Test
    void socketCloseKeepsResumeState() throws Exception {
        Gateway gateway = gateway(FAST, Gateway.ResumeState.EMPTY);
        CompletableFuture<Gateway.Outcome> outcome = start(gateway);

        FakeConnector.Connection conn = connector.awaitConnection(0);
        conn.hello("session-1");
        conn.send(event(3, "x"));
        conn.send("{\"s\":6,\"d\":{\"session_id\":\"session-2\"}}");
        conn.close(1006, "gone");

        assertEquals(Gateway.Outcome.LOST, outcome.get(5, TimeUnit.SECONDS));
        assertEquals(new Gateway.ResumeState("session-2", 3), gateway.resumeState());
        assertTrue(conn.socket().aborted);
    }

    @Test
    void sequenceNeverMovesBackwards() throws Exception {
        Gateway gateway = gateway(FAST, Gateway.ResumeState.EMPTY);
        CompletableFuture<Gateway.Outcome> outcome = start(gateway);

        FakeConnector.Connection conn = connector.awaitConnection(0);
        conn.hello("session-1");
        conn.send(event(7, "late"));
        conn.send(event(4, "early"));
        conn.close(1006, "gone");

        outcome.get(5, TimeUnit.SECONDS);
        assertEquals(7, gateway.resumeState().lastSequence());
        assertEquals(2, events.size());
    }

    @Test
    void onlyEventFramesAdvanceTheSequence() throws Exception {
        Gateway gateway = gateway(FAST, Gateway.ResumeState.EMPTY);
        CompletableFuture<Gateway.Outcome> outcome = start(gateway);

        FakeConnector.Connection conn = connector.awaitConnection(0);
        conn.hello("session-1");
        conn.send(event(2, "x"));
        conn.send("{\"s\":3,\"sn\":50}");
        conn.send("{\"s\":6,\"sn\":60,\"d\":{\"session_id\":\"session-1\"}}");
        conn.close(1006, "gone");

        assertEquals(Gateway.Outcome.LOST, outcome.get(5, TimeUnit.SECONDS));
        assertEquals(new Gateway.ResumeState("session-1", 2), gateway.resumeState());
    }

    @Test
    void malformedFramesAreSkipped() throws Exception {
        Gateway gateway = gateway(FAST, Gateway.ResumeState.EMPTY);
        CompletableFuture<Gateway.Outcome> outcome = start(gateway);

        FakeConnector.Connection conn = connector.awaitConnection(0);
        conn.hello("session-1");
        conn.send("{{{ not json");
        conn.send("{\"s\":0,\"sn\":1}");
        conn.send(event(2, "ok"));
        Wait.until(() -> events.size() == 1, "event after garbage");
        assertEquals(SessionState.LIVE, gateway.state());

        cancellation.cancel();
        assertEquals(Gateway.Outcome.CANCELLED, outcome.get(5, TimeUnit.SECONDS));
    }

    @Test
    void failedHeartbeatLosesTheConnection() throws Exception {
        Gateway gateway = gateway(FAST, Gateway.ResumeState.EMPTY);
        CompletableFuture<Gateway.Outcome> outcome = start(gateway);

        FakeConnector.Connection conn = connector.awaitConnection(0);
        conn.socket().failSends = true;
        conn.hello("session-1");

        assertEquals(Gateway.Outcome.LOST, outcome.get(5, TimeUnit.SECONDS));
        assertEquals("session-1", gateway.resumeState().sessionId());
    }

    @Test
    void endpointFailureEndsTheAttemptWithoutConnecting() throws Exception {
        api.gatewayResult = new KookResult.Failure<>("unauthorized", 401);
        Gateway gateway = gateway(FAST, Gateway.ResumeState.EMPTY);

        assertEquals(Gateway.Outcome.LOST, start(gateway).get(5, TimeUnit.SECONDS));
        assertTrue(connector.connections.isEmpty());
    }

    @Test
    void refusedConnectionIsLost() throws Exception {
        connector.refuse = true;
        Gateway gateway = gateway(FAST, Gateway.ResumeState.EMPTY);

        assertEquals(Gateway.Outcome.LOST, start(gateway).get(5, TimeUnit.SECONDS));
        assertEquals(1, connector.connections.size());
    }

    @Test
    void alreadyCancelledDoesNothing() throws Exception {
        cancellation.cancel();
        Gateway gateway = gateway(FAST, Gateway.ResumeState.EMPTY);

        assertEquals(Gateway.Outcome.CANCELLED, gateway.run(cancellation));
        assertEquals(0, api.gatewayCalls.get());
        assertThrows(IllegalStateException.class, () -> gateway.run(cancellation));
    }

    @Test
    void connectUrlCarriesResumeParameters() {
        assertEquals("wss://gw/ws?compress=0", Gateway.connectUrl("wss://gw/ws?compress=0", Gateway.ResumeState.EMPTY));
        assertEquals("wss://gw/ws?compress=0&resume=1&sn=12&session_id=abc",
            Gateway.connectUrl("wss://gw/ws?compress=0", new Gateway.ResumeState("abc", 12)));
        assertEquals("wss://gw/ws?resume=1&sn=0&session_id=a+b",
            Gateway.connectUrl("wss://gw/ws", new Gateway.ResumeState("a b", 0)));
    }
}
