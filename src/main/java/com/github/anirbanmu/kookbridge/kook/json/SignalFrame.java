package com.github.anirbanmu.kookbridge.kook.json;

// one record per gateway signal we understand. numbering follows the wire "s" field.
public sealed interface SignalFrame {
    int EVENT = 0;
    int HELLO = 1;
    int PING = 2;
    int PONG = 3;
    int RECONNECT = 5;
    int RESUME_ACK = 6;

    record Event(EventData data) implements SignalFrame {
    }

    // code 0 means the handshake (or resume) was accepted
    record Hello(int code, String sessionId) implements SignalFrame {
    }

    record Ping() implements SignalFrame {
    }

    record Pong() implements SignalFrame {
    }

    record Reconnect(int code, String err) implements SignalFrame {
    }

    record ResumeAck(String sessionId) implements SignalFrame {
    }
}
