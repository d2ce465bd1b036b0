package com.github.anirbanmu.kookbridge.inbound;

// downstream work for one admitted event. botId is null when the identity probe failed.
@FunctionalInterface
public interface EventHandler {
    void handle(InboundEvent event, String botId) throws Exception;
}
