package com.github.anirbanmu.kookbridge.inbound;

public record HistoryEntry(String senderId, String body, long timestampMs, String messageId) {
}
