package com.github.anirbanmu.kookbridge.kook.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import com.github.anirbanmu.kookbridge.util.Json;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

// raw gateway text <-> SignalFrame
public final class FrameCodec {

    public FrameCodec() {
    }

    // frame is null for signals we don't handle; sequence is kept either way
    public record ParseResult(SignalFrame frame, Integer sequence) {
    }

    public ParseResult decode(String raw) throws IOException {
        byte[] bytes = raw.getBytes(StandardCharsets.UTF_8);

        // first pass: signal and sequence only
        Envelope envelope = Json.read(Envelope.class, bytes);

        // second pass: typed "d" for the signals that carry one
        SignalFrame frame = switch (envelope.s()) {
            case SignalFrame.EVENT -> {
                EventMsg msg = Json.read(EventMsg.class, bytes);
                if (msg.d() == null) {
                    throw new IOException("event frame without payload");
                }
                yield new SignalFrame.Event(msg.d());
            }
            case SignalFrame.HELLO -> {
                HelloMsg msg = Json.read(HelloMsg.class, bytes);
                yield msg.d() == null
                    ? new SignalFrame.Hello(0, null)
                    : new SignalFrame.Hello(msg.d().code(), msg.d().sessionId());
            }
            case SignalFrame.PING -> new SignalFrame.Ping();
            case SignalFrame.PONG -> new SignalFrame.Pong();
            case SignalFrame.RECONNECT -> {
                ReconnectMsg msg = Json.read(ReconnectMsg.class, bytes);
                yield msg.d() == null
                    ? new SignalFrame.Reconnect(0, null)
                    : new SignalFrame.Reconnect(msg.d().code(), msg.d().err());
            }
            case SignalFrame.RESUME_ACK -> {
                ResumeAckMsg msg = Json.read(ResumeAckMsg.class, bytes);
                yield new SignalFrame.ResumeAck(msg.d() == null ? null : msg.d().sessionId());
            }
            default -> null;
        };

        return new ParseResult(frame, envelope.sn());
    }

    public String encodePing(int lastSequence) {
        return "{\"s\":" + SignalFrame.PING + ",\"sn\":" + lastSequence + "}";
    }

    // wire format records - private implementation details

    @CompiledJson
    record Envelope(int s, @JsonAttribute(nullable = true) Integer sn) {
    }

    @CompiledJson
    record EventMsg(int s, @JsonAttribute(nullable = true) EventData d, @JsonAttribute(nullable = true) Integer sn) {
    }

    @CompiledJson
    record HelloMsg(int s, @JsonAttribute(nullable = true) HelloData d) {
    }

    @CompiledJson
    record HelloData(int code, @JsonAttribute(name = "session_id", nullable = true) String sessionId) {
    }

    @CompiledJson
    record ReconnectMsg(int s, @JsonAttribute(nullable = true) ReconnectData d) {
    }

    @CompiledJson
    record ReconnectData(int code, @JsonAttribute(nullable = true) String err) {
    }

    @CompiledJson
    record ResumeAckMsg(int s, @JsonAttribute(nullable = true) ResumeAckData d) {
    }

    @CompiledJson
    record ResumeAckData(@JsonAttribute(name = "session_id", nullable = true) String sessionId) {
    }
}
