package com.github.anirbanmu.kookbridge.inbound;

import com.github.anirbanmu.kookbridge.kook.json.EventData;

public enum ChannelType {
    GROUP, DIRECT, BROADCAST;

    public static ChannelType fromWire(String value) {
        if (value == null) {
            return BROADCAST;
        }
        return switch (value) {
            case EventData.CHANNEL_GROUP -> GROUP;
            case EventData.CHANNEL_PERSON -> DIRECT;
            default -> BROADCAST;
        };
    }
}
