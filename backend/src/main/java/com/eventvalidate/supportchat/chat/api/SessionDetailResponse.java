package com.eventvalidate.supportchat.chat.api;

import com.eventvalidate.supportchat.chat.domain.ChatSession;

import java.util.List;

public record SessionDetailResponse(
        SessionSummaryItem session,
        List<MessageItem> messages
) {
    public static SessionDetailResponse of(ChatSession s) {
        return new SessionDetailResponse(
                SessionSummaryItem.of(s),
                s.messages().stream().map(MessageItem::of).toList()
        );
    }
}
