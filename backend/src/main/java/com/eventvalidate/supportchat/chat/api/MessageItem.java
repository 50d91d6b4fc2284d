package com.eventvalidate.supportchat.chat.api;

import com.eventvalidate.supportchat.chat.domain.ChatMessage;

public record MessageItem(
        String id,
        long seq,
        String sender,
        String text,
        long created_at
) {
    public static MessageItem of(ChatMessage m) {
        return new MessageItem(m.id(), m.seq(), m.sender().wireValue(), m.text(), m.timestamp().toEpochMilli());
    }
}
