package com.github.anirbanmu.kookbridge.host;

import com.github.anirbanmu.kookbridge.log.Log;
import java.time.format.DateTimeFormatter;

/**
 * Stand-in host for running the bridge on its own: every session is keyed by peer, notifications
 * are logged, and each dispatched message is answered by echoing its raw text.
 */
public class LoopbackHost implements HostRuntime {
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ISO_INSTANT;

    @Override
    public Route resolveRoute(Peer peer) {
        String key = peer.channel() + ":" + peer.accountId() + ":" + peer.kind().name().toLowerCase() + ":" + peer.id();
        return new Route(key, "echo");
    }

    @Override
    public void enqueueNotification(String text, NotificationContext context) {
        Log.info("host.notification", "session", context.sessionKey(), "context", context.contextKey(), "text", text);
    }

    @Override
    public String formatEnvelope(Envelope envelope) {
        return "[" + envelope.channel() + " " + envelope.from() + " " + TIMESTAMP.format(envelope.timestamp()) + "] " + envelope.body();
    }

    @Override
    public DispatchResult dispatchReply(InboundContext context, ReplyDispatcher dispatcher) {
        if (context.pairingRequired()) {
            Log.info("host.pairing_required", "sender", context.senderId());
            return new DispatchResult(false, 0, 0, 0);
        }
        dispatcher.deliver(context.rawBody());
        return new DispatchResult(true, 1, 0, 0);
    }
}
