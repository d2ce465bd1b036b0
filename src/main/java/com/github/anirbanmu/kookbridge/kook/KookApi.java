package com.github.anirbanmu.kookbridge.kook;

import com.github.anirbanmu.kookbridge.kook.json.RestPayloads.ChannelMessageRequest;
import com.github.anirbanmu.kookbridge.kook.json.RestPayloads.DirectMessageRequest;
import com.github.anirbanmu.kookbridge.kook.json.RestPayloads.SelfUser;

/**
 * The slice of the KOOK rest api the bridge consumes. One instance is bound to one bot token.
 */
public interface KookApi {

    /** {@code GET /gateway/index}: a fresh websocket url. Never assumed stable across reconnects. */
    KookResult<String> fetchGatewayEndpoint();

    /** {@code GET /user/me}: the bot's own user, used to recognise self-echo and mentions. */
    KookResult<SelfUser> fetchSelfIdentity();

    /** {@code POST /message/create}, returns the new message id. */
    KookResult<String> sendChannelMessage(ChannelMessageRequest request);

    /** {@code POST /direct-message/create}, returns the new message id. */
    KookResult<String> sendDirectMessage(DirectMessageRequest request);
}
