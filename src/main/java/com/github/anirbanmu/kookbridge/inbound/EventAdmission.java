package com.github.anirbanmu.kookbridge.inbound;

import com.github.anirbanmu.kookbridge.log.Log;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * First stop for every gateway event. Drops what the bot must never answer and hands the rest to
 * the handler as independent tasks, so a slow reply never holds up the gateway loop.
 */
public final class EventAdmission {
    private static final Set<Integer> SUPPORTED_TYPES = Set.of(
        InboundEvent.TYPE_TEXT, InboundEvent.TYPE_KMARKDOWN, InboundEvent.TYPE_CARD);

    public enum Verdict {
        ADMITTED, SELF_ECHO, SYSTEM_EVENT, UNSUPPORTED_TYPE
    }

    private final EventHandler handler;
    private final ExecutorService executor;
    private final Log.Scope log;

    public EventAdmission(String accountId, EventHandler handler, ExecutorService executor) {
        this.handler = handler;
        this.executor = executor;
        this.log = Log.scope("account", accountId);
    }

    public static Verdict classify(InboundEvent event, String botId) {
        if (botId != null && botId.equals(event.authorId())) {
            return Verdict.SELF_ECHO;
        }
        if (event.messageType() == InboundEvent.TYPE_SYSTEM) {
            return Verdict.SYSTEM_EVENT;
        }
        if (!SUPPORTED_TYPES.contains(event.messageType())) {
            return Verdict.UNSUPPORTED_TYPE;
        }
        return Verdict.ADMITTED;
    }

    // never blocks and never throws into the caller
    public Verdict offer(InboundEvent event, String botId) {
        Verdict verdict = classify(event, botId);
        if (verdict != Verdict.ADMITTED) {
            log.debug("inbound.dropped", "reason", verdict, "msg", event.messageId(), "type", event.messageType());
            return verdict;
        }

        try {
            executor.execute(() -> dispatch(event, botId));
        } catch (RejectedExecutionException ex) {
            log.warn("inbound.rejected_shutdown", "msg", event.messageId());
        }
        return verdict;
    }

    private void dispatch(InboundEvent event, String botId) {
        long start = System.nanoTime();
        try {
            handler.handle(event, botId);
        } catch (Exception ex) {
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            log.error("inbound.dispatch_failed", ex, "msg", event.messageId(), "channel", event.targetId(), "duration_ms", durationMs);
        }
    }

    // stop taking work and give in-flight handlers a grace period
    public void shutdown(Duration grace) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("inbound.handler_timeout", "grace_ms", grace.toMillis());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
