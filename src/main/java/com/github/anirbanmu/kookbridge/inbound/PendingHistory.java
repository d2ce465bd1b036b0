package com.github.anirbanmu.kookbridge.inbound;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Group messages that were seen but not addressed to the bot, kept per channel so they can be
 * replayed as context once somebody mentions it.
 *
 * <p>One instance belongs to one account. Handler tasks of that account run concurrently, so every
 * method is synchronized.
 */
public final class PendingHistory {
    public static final String HISTORY_CONTEXT_MARKER = "[Chat messages since your last reply - for context]";
    public static final String CURRENT_MESSAGE_MARKER = "[Current message - respond to this]";
    static final int MAX_CHANNELS = 1000;

    private final int maxChannels;

    // access order, so the channel touched longest ago is evicted first
    private final Map<String, Deque<HistoryEntry>> channels = new LinkedHashMap<>(16, 0.75f, true) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Deque<HistoryEntry>> eldest) {
            return size() > maxChannels;
        }
    };

    public PendingHistory() {
        this(MAX_CHANNELS);
    }

    PendingHistory(int maxChannels) {
        this.maxChannels = maxChannels;
    }

    // limit <= 0 turns buffering off
    public synchronized void record(String channelId, HistoryEntry entry, int limit) {
        if (limit <= 0) {
            return;
        }
        Deque<HistoryEntry> entries = channels.computeIfAbsent(channelId, k -> new ArrayDeque<>());
        entries.addLast(entry);
        while (entries.size() > limit) {
            entries.removeFirst();
        }
    }

    public synchronized List<HistoryEntry> snapshot(String channelId) {
        Deque<HistoryEntry> entries = channels.get(channelId);
        return entries == null ? List.of() : List.copyOf(entries);
    }

    // removes only what a dispatch consumed; entries recorded while it ran stay queued
    public synchronized void clear(String channelId, List<HistoryEntry> consumed) {
        Deque<HistoryEntry> entries = channels.get(channelId);
        if (entries == null) {
            return;
        }
        for (HistoryEntry entry : consumed) {
            entries.remove(entry);
        }
        if (entries.isEmpty()) {
            channels.remove(channelId);
        }
    }

    public synchronized int size(String channelId) {
        Deque<HistoryEntry> entries = channels.get(channelId);
        return entries == null ? 0 : entries.size();
    }

    public synchronized int channelCount() {
        return channels.size();
    }

    public static String buildContext(List<HistoryEntry> entries, String currentMessage, Function<HistoryEntry, String> format) {
        if (entries.isEmpty()) {
            return currentMessage;
        }
        List<String> lines = new ArrayList<>(entries.size());
        for (HistoryEntry entry : entries) {
            lines.add(format.apply(entry));
        }
        return HISTORY_CONTEXT_MARKER + "\n"
            + String.join("\n", lines)
            + "\n\n" + CURRENT_MESSAGE_MARKER + "\n"
            + currentMessage;
    }
}
