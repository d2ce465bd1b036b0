package com.github.anirbanmu.kookbridge.kook;

import com.github.anirbanmu.kookbridge.host.ReplyDispatcher;
import java.util.ArrayList;
import java.util.List;

// delivers agent replies to where the inbound message came from, quoting it
public class KookReplyDispatcher implements ReplyDispatcher {
    private final KookSender sender;
    private final String target;
    private final boolean direct;
    private final String replyTo;
    private final int chunkLimit;

    public KookReplyDispatcher(KookSender sender, String target, boolean direct, String replyTo, int chunkLimit) {
        if (chunkLimit < 1) {
            throw new IllegalArgumentException("chunkLimit must be at least 1, got " + chunkLimit);
        }
        this.sender = sender;
        this.target = target;
        this.direct = direct;
        this.replyTo = replyTo;
        this.chunkLimit = chunkLimit;
    }

    @Override
    public void deliver(String text) {
        if (text == null || text.isBlank()) {
            return;
        }
        for (String chunk : chunk(text, chunkLimit)) {
            sender.send(target, chunk, replyTo, direct);
        }
    }

    // splits on the last newline inside the limit, else the last whitespace, else hard at the limit
    public static List<String> chunk(String text, int limit) {
        List<String> chunks = new ArrayList<>();
        String rest = text;
        while (rest.length() > limit) {
            int cut = rest.lastIndexOf('\n', limit);
            if (cut <= 0) {
                cut = lastWhitespace(rest, limit);
            }
            if (cut <= 0) {
                cut = limit;
            }
            String head = rest.substring(0, cut).stripTrailing();
            if (!head.isEmpty()) {
                chunks.add(head);
            }
            rest = rest.substring(cut).stripLeading();
        }
        if (!rest.isBlank()) {
            chunks.add(rest);
        }
        return chunks;
    }

    private static int lastWhitespace(String s, int limit) {
        for (int i = Math.min(limit, s.length() - 1); i > 0; i--) {
            if (Character.isWhitespace(s.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
