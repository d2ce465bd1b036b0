package com.github.anirbanmu.kookbridge.inbound;

import com.github.anirbanmu.kookbridge.config.AccountResolver;
import com.github.anirbanmu.kookbridge.config.ResolvedAccount;
import com.github.anirbanmu.kookbridge.host.HostRuntime;
import com.github.anirbanmu.kookbridge.host.HostRuntime.DispatchResult;
import com.github.anirbanmu.kookbridge.host.HostRuntime.Envelope;
import com.github.anirbanmu.kookbridge.host.HostRuntime.InboundContext;
import com.github.anirbanmu.kookbridge.host.HostRuntime.NotificationContext;
import com.github.anirbanmu.kookbridge.host.HostRuntime.Peer;
import com.github.anirbanmu.kookbridge.host.HostRuntime.PeerKind;
import com.github.anirbanmu.kookbridge.host.HostRuntime.Route;
import com.github.anirbanmu.kookbridge.kook.KookReplyDispatcher;
import com.github.anirbanmu.kookbridge.kook.KookSender;
import com.github.anirbanmu.kookbridge.log.Log;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns one admitted event into a host dispatch: policy, history buffering, routing, envelope and
 * reply delivery. Account settings are looked up per event so config reloads apply immediately.
 */
public class MessageHandler implements EventHandler {
    public static final String CHANNEL = "KOOK";
    private static final int PREVIEW_LENGTH = 160;
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final String accountId;
    private final AccountResolver resolver;
    private final PendingHistory history;
    private final HostRuntime host;
    private final KookSender sender;
    private final Clock clock;
    private final Log.Scope log;

    public MessageHandler(String accountId, AccountResolver resolver, PendingHistory history, HostRuntime host, KookSender sender) {
        this(accountId, resolver, history, host, sender, Clock.systemUTC());
    }

    MessageHandler(String accountId, AccountResolver resolver, PendingHistory history, HostRuntime host, KookSender sender, Clock clock) {
        this.accountId = accountId;
        this.resolver = resolver;
        this.history = history;
        this.host = host;
        this.sender = sender;
        this.clock = clock;
        this.log = Log.scope("account", accountId);
    }

    @Override
    public void handle(InboundEvent event, String botId) {
        ResolvedAccount account = resolver.resolve(accountId);
        boolean mentioned = mentionsBot(event, botId);
        PolicyGate.Decision decision = PolicyGate.evaluate(account, event, mentioned);

        if (decision == PolicyGate.Decision.BUFFER_UNMENTIONED) {
            String content = stripBotMention(extractContent(event), botId);
            if (!content.isEmpty()) {
                history.record(event.targetId(),
                    new HistoryEntry(event.authorId(), senderName(event) + ": " + content, clock.millis(), event.messageId()),
                    account.historyLimit());
            }
            log.debug("inbound.buffered", "channel", event.targetId(), "msg", event.messageId());
            return;
        }
        if (!decision.dispatches()) {
            log.debug("inbound.rejected", "decision", decision, "channel", event.targetId(), "sender", event.authorId());
            return;
        }

        // a bare mention is still addressed to the bot and flushes pending history
        String content = stripBotMention(extractContent(event), botId);
        dispatch(account, event, content, mentioned, decision == PolicyGate.Decision.ACCEPT_PENDING_PAIRING);
    }

    private void dispatch(ResolvedAccount account, InboundEvent event, String content, boolean mentioned, boolean pairing) {
        boolean group = event.isGroup();
        String channelId = event.targetId();
        String senderId = event.authorId();
        String speaker = senderName(event);

        Route route = host.resolveRoute(new Peer(
            CHANNEL.toLowerCase(), account.accountId(), group ? PeerKind.GROUP : PeerKind.DIRECT, group ? channelId : senderId));

        String preview = preview(content);
        String notice = group
            ? "KOOK[" + account.accountId() + "] message in channel " + channelId + ": " + preview
            : "KOOK[" + account.accountId() + "] DM from " + senderId + ": " + preview;
        host.enqueueNotification(notice,
            new NotificationContext(route.sessionKey(), "kook:message:" + channelId + ":" + event.messageId()));

        StringBuilder body = new StringBuilder(speaker).append(": ");
        InboundEvent.Quote quote = event.extras().quote();
        if (quote != null && !quote.content().isEmpty()) {
            body.append("[Replying to: \"").append(quote.content()).append("\"]\n\n");
        }
        body.append(content);

        Instant timestamp = event.timestampMs() > 0 ? Instant.ofEpochMilli(event.timestampMs()) : clock.instant();
        String current = host.formatEnvelope(new Envelope(CHANNEL, group ? channelId + ":" + senderId : senderId, timestamp, body.toString()));

        List<HistoryEntry> pending = group ? history.snapshot(channelId) : List.of();
        String fullBody = PendingHistory.buildContext(pending, current, entry -> host.formatEnvelope(
            new Envelope(CHANNEL, channelId + ":" + entry.senderId(), Instant.ofEpochMilli(entry.timestampMs()), entry.body())));

        InboundContext context = new InboundContext(
            fullBody,
            content,
            "kook:" + senderId,
            group ? "channel:" + channelId : "user:" + senderId,
            route.sessionKey(),
            account.accountId(),
            group ? PeerKind.GROUP : PeerKind.DIRECT,
            group ? event.extras().channelName() : null,
            speaker,
            senderId,
            event.messageId(),
            event.timestampMs(),
            mentioned,
            pairing);

        KookReplyDispatcher dispatcher = new KookReplyDispatcher(
            sender, group ? channelId : senderId, !group, event.messageId(), account.textChunkLimit());
        DispatchResult result = host.dispatchReply(context, dispatcher);

        if (!pending.isEmpty()) {
            history.clear(channelId, pending);
        }
        log.info("inbound.dispatched", "channel", channelId, "msg", event.messageId(), "session", route.sessionKey(),
            "history", pending.size(), "final", result.finalReplies(), "block", result.blockReplies());
    }

    public static String extractContent(InboundEvent event) {
        String raw = event.extras().kmarkdownRaw();
        if (event.messageType() == InboundEvent.TYPE_KMARKDOWN && raw != null && !raw.isEmpty()) {
            return raw;
        }
        return event.content();
    }

    public static boolean mentionsBot(InboundEvent event, String botId) {
        return botId != null && event.extras().mentions().contains(botId);
    }

    public static String stripBotMention(String content, String botId) {
        String text = content;
        if (botId != null && !botId.isEmpty()) {
            text = text.replace("(met)" + botId + "(met)", " ");
        }
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    static String senderName(InboundEvent event) {
        InboundEvent.Author author = event.extras().author();
        if (author != null) {
            if (author.nickname() != null && !author.nickname().isBlank()) {
                return author.nickname();
            }
            if (author.username() != null && !author.username().isBlank()) {
                return author.username();
            }
        }
        return event.authorId();
    }

    static String preview(String content) {
        String collapsed = WHITESPACE.matcher(content).replaceAll(" ").trim();
        return collapsed.length() > PREVIEW_LENGTH ? collapsed.substring(0, PREVIEW_LENGTH) : collapsed;
    }
}
