package com.github.anirbanmu.kookbridge.config;

public enum GroupPolicy {
    OPEN, ALLOWLIST, DISABLED;

    public static GroupPolicy fromString(String value) {
        return switch (value.toLowerCase()) {
            case "open" -> OPEN;
            case "allowlist" -> ALLOWLIST;
            case "disabled" -> DISABLED;
            default -> throw new IllegalArgumentException(
                "Unknown groupPolicy: '" + value + "'. Valid values: open, allowlist, disabled");
        };
    }
}
