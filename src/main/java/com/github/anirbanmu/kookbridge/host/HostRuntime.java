package com.github.anirbanmu.kookbridge.host;

import java.time.Instant;

/**
 * Capabilities the bridge needs from the host messaging runtime. Passed to the components that use
 * it at construction time.
 */
public interface HostRuntime {

    /** Picks the agent session that owns a conversation. */
    Route resolveRoute(Peer peer);

    /** Records a short system notification against a session. */
    void enqueueNotification(String text, NotificationContext context);

    /** Renders one message in the host's envelope format. */
    String formatEnvelope(Envelope envelope);

    /**
     * Hands an inbound message to the agent and blocks until its replies have been handed to the
     * dispatcher. Throws when the host fails to process the message.
     */
    DispatchResult dispatchReply(InboundContext context, ReplyDispatcher dispatcher);

    enum PeerKind {
        GROUP, DIRECT
    }

    record Peer(String channel, String accountId, PeerKind kind, String id) {
    }

    record Route(String sessionKey, String agentId) {
    }

    record NotificationContext(String sessionKey, String contextKey) {
    }

    record Envelope(String channel, String from, Instant timestamp, String body) {
    }

    // everything the host needs to run the agent for one inbound message
    record InboundContext(
        String body,
        String rawBody,
        String from,
        String to,
        String sessionKey,
        String accountId,
        PeerKind chatType,
        String groupSubject,
        String senderName,
        String senderId,
        String messageId,
        long timestampMs,
        boolean wasMentioned,
        boolean pairingRequired) {
    }

    record DispatchResult(boolean queuedFinal, int finalReplies, int blockReplies, int toolReplies) {
    }
}
