package com.github.anirbanmu.kookbridge.kook.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import java.util.List;

// "d" of a signal 0 frame, as sent by the gateway
@CompiledJson
public record EventData(
    @JsonAttribute(name = "channel_type", nullable = true) String channelType,
    int type,
    @JsonAttribute(name = "target_id", nullable = true) String targetId,
    @JsonAttribute(name = "author_id", nullable = true) String authorId,
    @JsonAttribute(nullable = true) String content,
    @JsonAttribute(name = "msg_id", nullable = true) String msgId,
    @JsonAttribute(name = "msg_timestamp") long msgTimestamp,
    @JsonAttribute(nullable = true) String nonce,
    @JsonAttribute(nullable = true) Extra extra) {

    public static final String CHANNEL_GROUP = "GROUP";
    public static final String CHANNEL_PERSON = "PERSON";
    public static final String CHANNEL_BROADCAST = "BROADCAST";

    // extra.type is a number for messages and a string for system events, so it is not mapped
    @CompiledJson
    public record Extra(
        @JsonAttribute(name = "guild_id", nullable = true) String guildId,
        @JsonAttribute(name = "channel_name", nullable = true) String channelName,
        @JsonAttribute(nullable = true) List<String> mention,
        @JsonAttribute(name = "mention_all", nullable = true) Boolean mentionAll,
        @JsonAttribute(nullable = true) Author author,
        @JsonAttribute(nullable = true) KMarkdown kmarkdown,
        @JsonAttribute(nullable = true) String code,
        @JsonAttribute(nullable = true) Quote quote) {
    }

    @CompiledJson
    public record Author(
        @JsonAttribute(nullable = true) String id,
        @JsonAttribute(nullable = true) String username,
        @JsonAttribute(nullable = true) String nickname,
        @JsonAttribute(nullable = true) Boolean bot) {
    }

    @CompiledJson
    public record KMarkdown(@JsonAttribute(name = "raw_content", nullable = true) String rawContent) {
    }

    @CompiledJson
    public record Quote(
        @JsonAttribute(nullable = true) String id,
        @JsonAttribute(nullable = true) String content,
        @JsonAttribute(nullable = true) Author author) {
    }
}
