package com.github.anirbanmu.kookbridge.config;

public enum DmPolicy {
    OPEN, PAIRING, ALLOWLIST;

    public static DmPolicy fromString(String value) {
        return switch (value.toLowerCase()) {
            case "open" -> OPEN;
            case "pairing" -> PAIRING;
            case "allowlist" -> ALLOWLIST;
            default -> throw new IllegalArgumentException(
                "Unknown dmPolicy: '" + value + "'. Valid values: open, pairing, allowlist");
        };
    }
}
