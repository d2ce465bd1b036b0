package com.github.anirbanmu.kookbridge.inbound;

import com.github.anirbanmu.kookbridge.config.DmPolicy;
import com.github.anirbanmu.kookbridge.config.GroupConfig;
import com.github.anirbanmu.kookbridge.config.GroupPolicy;
import com.github.anirbanmu.kookbridge.config.ResolvedAccount;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Access control for one inbound message against the account's current settings.
 *
 * <p>Group messages go through the group policy, the per-channel switches and then the mention
 * gate. Direct messages only go through the dm policy. Nothing is remembered between calls.
 */
public final class PolicyGate {
    private static final Pattern ENTRY_PREFIX = Pattern.compile("^kook:(?:user:|channel:)?", Pattern.CASE_INSENSITIVE);

    public enum Decision {
        ACCEPT,
        // dm under pairing: the host decides whether the sender is approved
        ACCEPT_PENDING_PAIRING,
        // group message that did not address the bot; keep it as context only
        BUFFER_UNMENTIONED,
        REJECT_GROUP_POLICY,
        REJECT_CHANNEL_DISABLED,
        REJECT_SENDER_NOT_ALLOWED,
        REJECT_DM_POLICY,
        REJECT_BROADCAST;

        public boolean dispatches() {
            return this == ACCEPT || this == ACCEPT_PENDING_PAIRING;
        }
    }

    private PolicyGate() {
    }

    public static Decision evaluate(ResolvedAccount account, InboundEvent event, boolean mentionedBot) {
        return switch (event.channelType()) {
            case GROUP -> evaluateGroup(account, event, mentionedBot);
            case DIRECT -> evaluateDirect(account, event.authorId());
            case BROADCAST -> Decision.REJECT_BROADCAST;
        };
    }

    private static Decision evaluateGroup(ResolvedAccount account, InboundEvent event, boolean mentionedBot) {
        String channelId = event.targetId();
        String guildId = event.extras().guildId();
        GroupConfig group = account.groupFor(channelId, guildId);

        GroupPolicy policy = group != null && group.groupPolicy() != null ? group.groupPolicy() : account.groupPolicy();
        if (!isGroupAllowed(policy, account.groupAllowFrom(), guildId, channelId)) {
            return Decision.REJECT_GROUP_POLICY;
        }

        if (group != null && Boolean.FALSE.equals(group.enabled())) {
            return Decision.REJECT_CHANNEL_DISABLED;
        }

        if (group != null && group.allowFrom() != null && !group.allowFrom().isEmpty()
            && !matches(group.allowFrom(), event.authorId())) {
            return Decision.REJECT_SENDER_NOT_ALLOWED;
        }

        if (requireMention(account, group) && !mentionedBot) {
            return Decision.BUFFER_UNMENTIONED;
        }
        return Decision.ACCEPT;
    }

    private static Decision evaluateDirect(ResolvedAccount account, String senderId) {
        DmPolicy policy = account.dmPolicy();
        return switch (policy) {
            case OPEN -> Decision.ACCEPT;
            case ALLOWLIST -> matches(account.allowFrom(), senderId) ? Decision.ACCEPT : Decision.REJECT_DM_POLICY;
            case PAIRING -> Decision.ACCEPT_PENDING_PAIRING;
        };
    }

    public static boolean isGroupAllowed(GroupPolicy policy, List<String> allowFrom, String guildId, String channelId) {
        return switch (policy) {
            case DISABLED -> false;
            case OPEN -> true;
            case ALLOWLIST -> matches(allowFrom, guildId) || matches(allowFrom, channelId);
        };
    }

    public static boolean requireMention(ResolvedAccount account, GroupConfig group) {
        if (group != null && group.requireMention() != null) {
            return group.requireMention();
        }
        return account.requireMention();
    }

    static boolean matches(List<String> allowFrom, String id) {
        if (id == null || id.isEmpty() || allowFrom == null) {
            return false;
        }
        for (String entry : allowFrom) {
            if (normalizeEntry(entry).equals(id)) {
                return true;
            }
        }
        return false;
    }

    public static String normalizeEntry(String entry) {
        return ENTRY_PREFIX.matcher(entry.trim()).replaceFirst("");
    }
}
