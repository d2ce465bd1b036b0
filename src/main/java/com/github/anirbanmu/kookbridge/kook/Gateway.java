package com.github.anirbanmu.kookbridge.kook;

import com.github.anirbanmu.kookbridge.kook.json.EventData;
import com.github.anirbanmu.kookbridge.kook.json.FrameCodec;
import com.github.anirbanmu.kookbridge.kook.json.FrameCodec.ParseResult;
import com.github.anirbanmu.kookbridge.kook.json.SignalFrame;
import com.github.anirbanmu.kookbridge.log.Log;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

// single-use kook gateway connection. fetches an endpoint, connects once, runs until dead.
// resume state can be read after death and passed into a new instance.
//
// the socket listener and both timers only enqueue inputs; run() consumes them on one thread,
// so every transition happens in order and a late timer tick after close is ignored.
public class Gateway {
    public enum Outcome {
        // stopped by the cancellation signal, do not reconnect
        CANCELLED,
        // connection lost, session may still be resumable
        LOST,
        // server refused or dropped the session, start fresh
        RESET
    }

    public record ResumeState(String sessionId, int lastSequence) {
        public static final ResumeState EMPTY = new ResumeState(null, 0);

        public boolean canResume() {
            return sessionId != null && !sessionId.isEmpty();
        }
    }

    sealed interface Input {
    }

    record Opened(WebSocket socket) implements Input {
    }

    record Text(String raw) implements Input {
    }

    record Closed(int code, String reason) implements Input {
    }

    record Failed(Throwable error) implements Input {
    }

    record HelloTimeout() implements Input {
    }

    record HeartbeatDue() implements Input {
    }

    record SendFailed(Throwable error) implements Input {
    }

    record Cancelled() implements Input {
    }

    private final KookApi api;
    private final GatewayConnector connector;
    private final GatewayTimings timings;
    private final ScheduledExecutorService timers;
    private final Consumer<EventData> eventSink;
    private final Runnable onLive;
    private final FrameCodec codec = new FrameCodec();
    private final BlockingQueue<Input> inputs = new LinkedBlockingQueue<>();
    private final Log.Scope log;

    private volatile SessionState state = SessionState.DISCONNECTED;
    private volatile String sessionId;
    private volatile int lastSequence;
    private volatile boolean reachedLive;
    private volatile boolean finished;

    private volatile WebSocket socket;
    private ScheduledFuture<?> helloTimer;
    private ScheduledFuture<?> heartbeat;
    private boolean used;

    public Gateway(
        String accountId,
        KookApi api,
        GatewayConnector connector,
        GatewayTimings timings,
        ScheduledExecutorService timers,
        ResumeState resume,
        Consumer<EventData> eventSink,
        Runnable onLive) {
        this.api = api;
        this.connector = connector;
        this.timings = timings;
        this.timers = timers;
        this.eventSink = eventSink;
        this.onLive = onLive;
        this.log = Log.scope("account", accountId);
        if (resume != null) {
            this.sessionId = resume.sessionId();
            this.lastSequence = resume.lastSequence();
        }
    }

    public SessionState state() {
        return state;
    }

    // true if a hello was accepted on this connection
    public boolean reachedLive() {
        return reachedLive;
    }

    public ResumeState resumeState() {
        return new ResumeState(sessionId, lastSequence);
    }

    // blocks until this connection dies or the cancellation fires
    public Outcome run(Cancellation cancellation) {
        synchronized (this) {
            if (used) {
                throw new IllegalStateException("gateway instances are single-use");
            }
            used = true;
        }

        Outcome outcome = Outcome.LOST;
        try (Cancellation.Registration ignored = cancellation.onCancel(() -> inputs.add(new Cancelled()))) {
            outcome = connectAndServe();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            outcome = Outcome.CANCELLED;
        } finally {
            close(outcome);
        }
        return outcome;
    }

    private Outcome connectAndServe() throws InterruptedException {
        if (inputs.peek() instanceof Cancelled) {
            return Outcome.CANCELLED;
        }

        state = SessionState.FETCHING_ENDPOINT;
        KookResult<String> endpoint = api.fetchGatewayEndpoint();
        if (endpoint instanceof KookResult.Failure<String> f) {
            log.warn("gateway.endpoint_failed", "error", f.message(), "code", f.code());
            return Outcome.LOST;
        }
        if (inputs.peek() instanceof Cancelled) {
            return Outcome.CANCELLED;
        }

        URI uri;
        try {
            uri = URI.create(connectUrl(((KookResult.Success<String>) endpoint).value(), resumeState()));
        } catch (IllegalArgumentException ex) {
            log.warn("gateway.bad_endpoint", ex);
            return Outcome.LOST;
        }
        state = SessionState.CONNECTING;
        log.info("gateway.connecting", "resume", resumeState().canResume(), "sn", lastSequence);
        connector.open(uri, new Listener()).whenComplete((ws, error) -> {
            if (error != null) {
                inputs.add(new Failed(error));
            }
        });

        while (true) {
            Input input = inputs.take();
            Outcome outcome = step(input);
            if (outcome != null) {
                return outcome;
            }
        }
    }

    // one transition; a non-null result ends the connection
    private Outcome step(Input input) {
        if (input instanceof Cancelled) {
            log.info("gateway.cancelled", "state", state);
            return Outcome.CANCELLED;
        }
        if (input instanceof Opened) {
            state = SessionState.AWAITING_HELLO;
            helloTimer = timers.schedule(() -> inputs.add(new HelloTimeout()),
                timings.helloTimeout().toMillis(), TimeUnit.MILLISECONDS);
            log.info("gateway.connected");
            return null;
        }
        if (input instanceof Text text) {
            return handleText(text.raw());
        }
        if (input instanceof Closed closed) {
            log.info("gateway.closed", "code", closed.code(), "reason", closed.reason(), "state", state);
            return Outcome.LOST;
        }
        if (input instanceof Failed failed) {
            log.warn("gateway.error", failed.error(), "state", state);
            return Outcome.LOST;
        }
        if (input instanceof HelloTimeout) {
            if (state != SessionState.AWAITING_HELLO) {
                return null;
            }
            log.warn("gateway.hello_timeout", "timeout_ms", timings.helloTimeout().toMillis());
            return Outcome.LOST;
        }
        if (input instanceof HeartbeatDue) {
            return sendPing();
        }
        if (input instanceof SendFailed failed) {
            log.warn("gateway.heartbeat_send_failed", failed.error());
            return Outcome.LOST;
        }
        throw new IllegalStateException("unhandled input " + input);
    }

    private Outcome handleText(String raw) {
        ParseResult result;
        try {
            result = codec.decode(raw);
        } catch (IOException ex) {
            log.warn("gateway.malformed_frame", ex, "length", raw.length());
            return null;
        }

        SignalFrame frame = result.frame();
        if (frame == null) {
            return null;
        }

        if (frame instanceof SignalFrame.Hello hello) {
            return handleHello(hello);
        }
        if (frame instanceof SignalFrame.Event event) {
            if (result.sequence() != null && result.sequence() > lastSequence) {
                lastSequence = result.sequence();
            }
            eventSink.accept(event.data());
            return null;
        }
        if (frame instanceof SignalFrame.Pong) {
            log.debug("gateway.pong");
            return null;
        }
        if (frame instanceof SignalFrame.Reconnect reconnect) {
            log.info("gateway.reconnect_requested", "code", reconnect.code(), "err", reconnect.err());
            resetSession();
            return Outcome.RESET;
        }
        if (frame instanceof SignalFrame.ResumeAck ack) {
            if (ack.sessionId() != null && !ack.sessionId().isEmpty()) {
                sessionId = ack.sessionId();
            }
            log.info("gateway.resumed", "session", redact(sessionId), "sn", lastSequence);
            return null;
        }
        // server side ping is not part of the protocol; nothing to answer
        return null;
    }

    private Outcome handleHello(SignalFrame.Hello hello) {
        if (state != SessionState.AWAITING_HELLO) {
            log.debug("gateway.unexpected_hello", "state", state);
            return null;
        }
        cancelTimer(helloTimer);
        helloTimer = null;

        if (hello.code() != 0) {
            log.warn("gateway.hello_rejected", "code", hello.code());
            resetSession();
            return Outcome.RESET;
        }

        if (hello.sessionId() != null && !hello.sessionId().isEmpty()) {
            sessionId = hello.sessionId();
        }
        long interval = timings.heartbeatInterval().toMillis();
        heartbeat = timers.scheduleAtFixedRate(() -> inputs.add(new HeartbeatDue()), interval, interval, TimeUnit.MILLISECONDS);
        state = SessionState.LIVE;
        reachedLive = true;
        log.info("gateway.hello", "session", redact(sessionId), "heartbeat_ms", interval);
        onLive.run();
        return null;
    }

    private Outcome sendPing() {
        WebSocket ws = socket;
        if (state != SessionState.LIVE || ws == null) {
            return null;
        }
        try {
            ws.sendText(codec.encodePing(lastSequence), true).whenComplete((r, error) -> {
                if (error != null) {
                    inputs.add(new SendFailed(error));
                }
            });
        } catch (RuntimeException ex) {
            log.warn("gateway.heartbeat_send_failed", ex);
            return Outcome.LOST;
        }
        log.debug("gateway.ping", "sn", lastSequence);
        return null;
    }

    private void resetSession() {
        sessionId = null;
        lastSequence = 0;
    }

    // stops both timers and the socket; safe to call more than once
    private synchronized void close(Outcome outcome) {
        if (finished) {
            return;
        }
        finished = true;
        state = SessionState.CLOSING;

        cancelTimer(helloTimer);
        cancelTimer(heartbeat);
        helloTimer = null;
        heartbeat = null;

        WebSocket ws = socket;
        socket = null;
        if (ws != null) {
            closeSocket(ws, outcome == Outcome.CANCELLED);
        }
        state = SessionState.DISCONNECTED;
    }

    // called from the socket thread; close() may already have run on the session thread
    private synchronized boolean attach(WebSocket ws) {
        if (finished) {
            return false;
        }
        socket = ws;
        return true;
    }

    private void closeSocket(WebSocket ws, boolean graceful) {
        if (graceful && !ws.isOutputClosed()) {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "closing").whenComplete((r, error) -> {
                if (error != null) {
                    ws.abort();
                }
            });
        } else {
            ws.abort();
        }
    }

    private static void cancelTimer(ScheduledFuture<?> timer) {
        if (timer != null) {
            timer.cancel(false);
        }
    }

    static String connectUrl(String endpoint, ResumeState resume) {
        if (!resume.canResume()) {
            return endpoint;
        }
        String separator = endpoint.contains("?") ? "&" : "?";
        return endpoint + separator
            + "resume=1&sn=" + resume.lastSequence()
            + "&session_id=" + URLEncoder.encode(resume.sessionId(), StandardCharsets.UTF_8);
    }

    private static String redact(String id) {
        if (id == null) {
            return null;
        }
        return id.length() > 4 ? "..." + id.substring(id.length() - 4) : "REDACTED";
    }

    private class Listener implements WebSocket.Listener {
        private final StringBuilder messageBuffer = new StringBuilder();

        @Override
        public void onOpen(WebSocket webSocket) {
            if (!attach(webSocket)) {
                // opened after we gave up on this connection
                webSocket.abort();
                return;
            }
            inputs.add(new Opened(webSocket));
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            messageBuffer.append(data);
            if (last) {
                inputs.add(new Text(messageBuffer.toString()));
                messageBuffer.setLength(0);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            inputs.add(new Closed(statusCode, reason));
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            inputs.add(new Failed(error));
        }
    }
}
