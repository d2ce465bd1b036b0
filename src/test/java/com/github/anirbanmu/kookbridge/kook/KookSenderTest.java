package com.github.anirbanmu.kookbridge.kook;

import static org.junit.jupiter.api.Assertions.*;

import com.github.anirbanmu.kookbridge.kook.json.RestPayloads.DirectMessageRequest;
import com.github.anirbanmu.kookbridge.testing.FakeKookApi;
import org.junit.jupiter.api.Test;

class KookSenderTest {

    private final FakeKookApi api = new FakeKookApi();
    private final KookSender sender = new KookSender(api);

    @Test
    void normalizesTargets() {
        assertEquals("123", KookSender.normalizeTarget("kook:channel:123"));
        assertEquals("123", KookSender.normalizeTarget("kook:user:123"));
        assertEquals("123", KookSender.normalizeTarget("kook:dm:123"));
        assertEquals("123", KookSender.normalizeTarget("kook:group:123"));
        assertEquals("123", KookSender.normalizeTarget("kook:123"));
        assertEquals("123", KookSender.normalizeTarget("user:123"));
        assertEquals("123", KookSender.normalizeTarget(" 123 "));
    }

    @Test
    void channelTargetsGoToMessageCreate() {
        String id = sender.send("kook:channel:chan-1", "hello", "msg-9", false);

        assertEquals("sent-1", id);
        assertEquals(1, api.channelMessages.size());
        assertEquals("chan-1", api.channelMessages.get(0).targetId());
        assertEquals("msg-9", api.channelMessages.get(0).quote());
        assertTrue(api.directMessages.isEmpty());
    }

    @Test
    void userPrefixMeansDirectMessage() {
        sender.send("user:42", "hello", null, false);

        DirectMessageRequest sent = api.directMessages.get(0);
        assertEquals("42", sent.targetId());
        assertNull(sent.chatCode());
        assertNull(sent.quote());
    }

    @Test
    void chatCodeTargetsUseTheCode() {
        String code = "0123456789abcdef01234567";
        sender.send(code, "hello", null, true);

        DirectMessageRequest sent = api.directMessages.get(0);
        assertNull(sent.targetId());
        assertEquals(code, sent.chatCode());
        assertTrue(KookSender.isChatCode(code));
        assertFalse(KookSender.isChatCode("12345"));
    }

    @Test
    void apiFailureThrows() {
        api.sendResult = new KookResult.Failure<>("no permission", 40000);

        KookApiException e = assertThrows(KookApiException.class, () -> sender.send("chan-1", "hello", null, false));
        assertEquals(40000, e.code());
        assertTrue(e.getMessage().contains("no permission"));
    }

    @Test
    void emptyTargetIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> sender.send("kook:", "hello", null, false));
    }
}
