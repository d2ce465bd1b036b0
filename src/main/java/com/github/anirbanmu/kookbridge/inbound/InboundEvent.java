package com.github.anirbanmu.kookbridge.inbound;

import com.github.anirbanmu.kookbridge.kook.json.EventData;
import java.util.List;

// a gateway message event with wire quirks smoothed out: no null strings or lists
public record InboundEvent(
    ChannelType channelType,
    int messageType,
    String targetId,
    String authorId,
    String content,
    String messageId,
    long timestampMs,
    String nonce,
    Extras extras) {

    public static final int TYPE_TEXT = 1;
    public static final int TYPE_KMARKDOWN = 9;
    public static final int TYPE_CARD = 10;
    public static final int TYPE_SYSTEM = 255;

    public record Extras(
        List<String> mentions,
        boolean mentionAll,
        String guildId,
        String channelName,
        Author author,
        String kmarkdownRaw,
        String chatCode,
        Quote quote) {

        public static final Extras EMPTY = new Extras(List.of(), false, "", "", null, null, null, null);
    }

    public record Author(String id, String username, String nickname, boolean bot) {
    }

    public record Quote(String messageId, String content, String authorId, String authorName) {
    }

    public boolean isGroup() {
        return channelType == ChannelType.GROUP;
    }

    public static InboundEvent from(EventData data) {
        return new InboundEvent(
            ChannelType.fromWire(data.channelType()),
            data.type(),
            orEmpty(data.targetId()),
            orEmpty(data.authorId()),
            orEmpty(data.content()),
            orEmpty(data.msgId()),
            data.msgTimestamp(),
            orEmpty(data.nonce()),
            extras(data.extra()));
    }

    private static Extras extras(EventData.Extra extra) {
        if (extra == null) {
            return Extras.EMPTY;
        }
        EventData.KMarkdown kmarkdown = extra.kmarkdown();
        return new Extras(
            extra.mention() == null ? List.of() : List.copyOf(extra.mention()),
            Boolean.TRUE.equals(extra.mentionAll()),
            orEmpty(extra.guildId()),
            orEmpty(extra.channelName()),
            author(extra.author()),
            kmarkdown == null ? null : kmarkdown.rawContent(),
            extra.code(),
            quote(extra.quote()));
    }

    private static Author author(EventData.Author author) {
        if (author == null) {
            return null;
        }
        return new Author(orEmpty(author.id()), author.username(), author.nickname(), Boolean.TRUE.equals(author.bot()));
    }

    private static Quote quote(EventData.Quote quote) {
        if (quote == null) {
            return null;
        }
        EventData.Author author = quote.author();
        return new Quote(
            orEmpty(quote.id()),
            orEmpty(quote.content()),
            author == null ? "" : orEmpty(author.id()),
            author == null ? null : author.username());
    }

    private static String orEmpty(String s) {
        return s == null ? "" : s;
    }
}
