package com.github.anirbanmu.kookbridge.config;

import java.util.List;

// per-channel (or per-guild, or "*") overrides. null means inherit.
public record GroupConfig(Boolean enabled, Boolean requireMention, GroupPolicy groupPolicy, List<String> allowFrom) {
    public static final String WILDCARD = "*";
}
