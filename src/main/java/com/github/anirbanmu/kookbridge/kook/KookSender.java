package com.github.anirbanmu.kookbridge.kook;

import com.github.anirbanmu.kookbridge.kook.json.RestPayloads.ChannelMessageRequest;
import com.github.anirbanmu.kookbridge.kook.json.RestPayloads.DirectMessageRequest;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Sends KMarkdown messages to a channel or a direct-message conversation.
 *
 * <p>Targets may carry the prefixes other parts of the host use ({@code kook:channel:},
 * {@code kook:user:} and so on). A direct target that looks like a chat code is sent by code instead
 * of by user id.
 */
public class KookSender {
    private static final List<String> TARGET_PREFIXES = List.of(
        "kook:channel:", "kook:user:", "kook:dm:", "kook:group:", "kook:");
    private static final Pattern CHAT_CODE = Pattern.compile("^[a-f0-9]{24,}$");

    private final KookApi api;

    public KookSender(KookApi api) {
        this.api = api;
    }

    public static String normalizeTarget(String target) {
        String trimmed = target.trim();
        String lower = trimmed.toLowerCase();
        for (String prefix : TARGET_PREFIXES) {
            if (lower.startsWith(prefix)) {
                return trimmed.substring(prefix.length());
            }
        }
        if (lower.startsWith("user:")) {
            return trimmed.substring("user:".length());
        }
        if (lower.startsWith("channel:")) {
            return trimmed.substring("channel:".length());
        }
        return trimmed;
    }

    public static boolean isDirectTarget(String target) {
        String lower = target.trim().toLowerCase();
        return lower.startsWith("user:") || lower.startsWith("kook:user:") || lower.startsWith("kook:dm:");
    }

    public static boolean isChatCode(String id) {
        return CHAT_CODE.matcher(id).matches();
    }

    // returns the created message id
    public String send(String target, String content, String replyTo, boolean direct) {
        String id = normalizeTarget(target);
        if (id.isEmpty()) {
            throw new IllegalArgumentException("empty send target: " + target);
        }

        KookResult<String> result;
        if (direct || isDirectTarget(target)) {
            DirectMessageRequest request = isChatCode(id)
                ? DirectMessageRequest.toChat(id, content, replyTo)
                : DirectMessageRequest.toUser(id, content, replyTo);
            result = api.sendDirectMessage(request);
        } else {
            result = api.sendChannelMessage(ChannelMessageRequest.kmarkdown(id, content, replyTo));
        }

        if (result instanceof KookResult.Failure<String> f) {
            throw new KookApiException("send to " + id + " failed: " + f.message(), f.code(), f.exception());
        }
        return ((KookResult.Success<String>) result).value();
    }
}
