package com.eventvalidate.supportchat.chat.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * One immutable chat line. {@code seq} starts at 1 and grows by one per session, so ordering by
 * {@code seq} is the delivery order.
 */
public record ChatMessage(
        String id,
        String sessionId,
        long seq,
        String text,
        MessageSender sender,
        Instant timestamp
) {
    public ChatMessage {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(timestamp, "timestamp");
        if (seq < 1) {
            throw new IllegalArgumentException("invalid_message_seq");
        }
        text = text == null ? "" : text;
    }
}
