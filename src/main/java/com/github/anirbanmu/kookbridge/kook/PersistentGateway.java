package com.github.anirbanmu.kookbridge.kook;

import com.github.anirbanmu.kookbridge.inbound.EventAdmission;
import com.github.anirbanmu.kookbridge.inbound.InboundEvent;
import com.github.anirbanmu.kookbridge.kook.json.EventData;
import com.github.anirbanmu.kookbridge.kook.json.RestPayloads.SelfUser;
import com.github.anirbanmu.kookbridge.log.Log;
import com.github.anirbanmu.kookbridge.util.Threads;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

// reconnect loop around Gateway. creates a fresh gateway each iteration,
// carries resume state across, backs off exponentially while connections keep failing.
public class PersistentGateway {
    public record ReconnectState(int attemptCount, long nextWaitMs) {
    }

    private final String accountId;
    private final KookApi api;
    private final GatewayConnector connector;
    private final GatewayTimings timings;
    private final EventAdmission admission;
    private final Log.Scope log;

    private volatile Gateway current;
    private volatile String botId;
    private volatile int attempt;
    private volatile ReconnectState reconnectState = new ReconnectState(0, 0);

    public PersistentGateway(String accountId, KookApi api, GatewayConnector connector, GatewayTimings timings, EventAdmission admission) {
        this.accountId = accountId;
        this.api = api;
        this.connector = connector;
        this.timings = timings;
        this.admission = admission;
        this.log = Log.scope("account", accountId);
    }

    public boolean isHealthy() {
        Gateway gw = current;
        return gw != null && gw.state() == SessionState.LIVE;
    }

    public ReconnectState reconnectState() {
        return reconnectState;
    }

    public String botId() {
        return botId;
    }

    // blocks until the cancellation fires
    public void run(Cancellation cancellation) {
        ScheduledExecutorService timers = Executors.newSingleThreadScheduledExecutor(Threads.daemonFactory("kook-timer-" + accountId));
        Gateway.ResumeState resume = Gateway.ResumeState.EMPTY;
        try {
            while (!cancellation.isCancelled() && !Thread.currentThread().isInterrupted()) {
                if (!resume.canResume()) {
                    // identity only changes with a fresh session; resumes reuse it
                    botId = resolveBotId();
                }

                Gateway gw = new Gateway(accountId, api, connector, timings, timers, resume, this::onEvent, this::onLive);
                current = gw;
                Gateway.Outcome outcome;
                try {
                    outcome = gw.run(cancellation);
                } finally {
                    current = null;
                }
                resume = gw.resumeState();

                if (outcome == Gateway.Outcome.CANCELLED || cancellation.isCancelled()) {
                    break;
                }

                attempt++;
                long delay = timings.reconnectDelayMillis(attempt);
                reconnectState = new ReconnectState(attempt, delay);
                log.info("gateway.reconnect_scheduled", "attempt", attempt, "delay_ms", delay, "outcome", outcome, "resume", resume.canResume());

                if (cancellation.await(delay)) {
                    break;
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        } finally {
            timers.shutdownNow();
            log.info("gateway.stopped");
        }
    }

    private void onLive() {
        attempt = 0;
        reconnectState = new ReconnectState(0, 0);
    }

    private void onEvent(EventData data) {
        admission.offer(InboundEvent.from(data), botId);
    }

    // null when the probe fails; self-echo filtering is skipped until the next fresh session
    String resolveBotId() {
        KookResult<SelfUser> result = api.fetchSelfIdentity();
        if (result instanceof KookResult.Success<SelfUser> s && s.value().id() != null) {
            log.info("gateway.identity", "bot_id", s.value().id(), "name", s.value().username());
            return s.value().id();
        }
        if (result instanceof KookResult.Failure<SelfUser> f) {
            log.warn("gateway.identity_failed", "error", f.message(), "code", f.code());
        }
        return null;
    }
}
