package com.github.anirbanmu.kookbridge.config;

import java.util.List;
import java.util.Map;

// effective settings for one account after merging. built fresh by
// AccountResolver on every lookup.
public record ResolvedAccount(
    String accountId,
    boolean enabled,
    boolean configured,
    String name,
    String token,
    TokenSource tokenSource,
    DmPolicy dmPolicy,
    List<String> allowFrom,
    GroupPolicy groupPolicy,
    List<String> groupAllowFrom,
    boolean requireMention,
    int textChunkLimit,
    int historyLimit,
    Map<String, GroupConfig> groups) {

    public enum TokenSource {
        CONFIG, ENV, NONE
    }

    // channel id first, then guild id, then "*"
    public GroupConfig groupFor(String channelId, String guildId) {
        GroupConfig group = channelId == null ? null : groups.get(channelId);
        if (group == null && guildId != null && !guildId.isEmpty()) {
            group = groups.get(guildId);
        }
        if (group == null) {
            group = groups.get(GroupConfig.WILDCARD);
        }
        return group;
    }
}
