package com.github.anirbanmu.kookbridge.kook.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;

// request and response bodies of the rest endpoints we call.
// every response is wrapped as {code, message, data}; code 0 is success.
public final class RestPayloads {
    public static final int MESSAGE_TYPE_KMARKDOWN = 9;

    private RestPayloads() {
    }

    @CompiledJson
    public record GatewayIndexResponse(int code, @JsonAttribute(nullable = true) String message, @JsonAttribute(nullable = true) GatewayIndex data) {
    }

    @CompiledJson
    public record GatewayIndex(@JsonAttribute(nullable = true) String url) {
    }

    @CompiledJson
    public record SelfUserResponse(int code, @JsonAttribute(nullable = true) String message, @JsonAttribute(nullable = true) SelfUser data) {
    }

    @CompiledJson
    public record SelfUser(@JsonAttribute(nullable = true) String id, @JsonAttribute(nullable = true) String username, @JsonAttribute(nullable = true) Boolean bot) {
    }

    @CompiledJson
    public record MessageCreateResponse(int code, @JsonAttribute(nullable = true) String message, @JsonAttribute(nullable = true) MessageCreated data) {
    }

    @CompiledJson
    public record MessageCreated(@JsonAttribute(name = "msg_id", nullable = true) String msgId, @JsonAttribute(name = "msg_timestamp") long msgTimestamp, @JsonAttribute(nullable = true) String nonce) {
    }

    // POST /message/create
    @CompiledJson
    public record ChannelMessageRequest(
        @JsonAttribute(name = "target_id") String targetId,
        String content,
        int type,
        @JsonAttribute(nullable = true) String quote) {

        public static ChannelMessageRequest kmarkdown(String targetId, String content, String quote) {
            return new ChannelMessageRequest(targetId, content, MESSAGE_TYPE_KMARKDOWN, quote);
        }
    }

    // POST /direct-message/create. exactly one of targetId / chatCode is set.
    @CompiledJson
    public record DirectMessageRequest(
        @JsonAttribute(name = "target_id", nullable = true) String targetId,
        @JsonAttribute(name = "chat_code", nullable = true) String chatCode,
        String content,
        int type,
        @JsonAttribute(nullable = true) String quote) {

        public static DirectMessageRequest toUser(String userId, String content, String quote) {
            return new DirectMessageRequest(userId, null, content, MESSAGE_TYPE_KMARKDOWN, quote);
        }

        public static DirectMessageRequest toChat(String chatCode, String content, String quote) {
            return new DirectMessageRequest(null, chatCode, content, MESSAGE_TYPE_KMARKDOWN, quote);
        }
    }
}
