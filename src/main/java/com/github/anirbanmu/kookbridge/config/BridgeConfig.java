package com.github.anirbanmu.kookbridge.config;

import java.util.Map;

// global [kook] section, its named accounts, and the host-wide group history limit
public record BridgeConfig(AccountConfig kook, Map<String, AccountConfig> accounts, Integer groupHistoryLimit) {
    public static final BridgeConfig EMPTY = new BridgeConfig(AccountConfig.EMPTY, Map.of(), null);
}
