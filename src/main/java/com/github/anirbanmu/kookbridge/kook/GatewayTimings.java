package com.github.anirbanmu.kookbridge.kook;

import java.time.Duration;

// protocol timers plus reconnect backoff. tests pass short values.
public record GatewayTimings(Duration helloTimeout, Duration heartbeatInterval, Duration reconnectBase, Duration reconnectMax) {
    public static final GatewayTimings DEFAULT = new GatewayTimings(
        Duration.ofMillis(6000), Duration.ofMillis(30_000), Duration.ofMillis(2000), Duration.ofMillis(60_000));

    // attempt is 1-based: base, 2*base, 4*base ... capped at max
    public long reconnectDelayMillis(int attempt) {
        int exponent = Math.min(Math.max(attempt, 1) - 1, 20);
        long delay = reconnectBase.toMillis() * (1L << exponent);
        return Math.min(delay, reconnectMax.toMillis());
    }
}
