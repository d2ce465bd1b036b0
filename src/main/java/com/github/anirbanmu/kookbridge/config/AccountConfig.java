package com.github.anirbanmu.kookbridge.config;

import java.util.List;
import java.util.Map;

// one [kook] or [kook.accounts.<id>] section as written. every field is
// nullable; AccountResolver fills the gaps.
public record AccountConfig(
    Boolean enabled,
    String name,
    String token,
    DmPolicy dmPolicy,
    List<String> allowFrom,
    GroupPolicy groupPolicy,
    List<String> groupAllowFrom,
    Boolean requireMention,
    Integer textChunkLimit,
    Integer historyLimit,
    Map<String, GroupConfig> groups) {

    public static final AccountConfig EMPTY = new AccountConfig(
        null, null, null, null, null, null, null, null, null, null, Map.of());
}
