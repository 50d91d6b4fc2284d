package com.eventvalidate.supportchat.chat.api;

import com.eventvalidate.supportchat.chat.domain.ChatSession;

public record SessionSummaryItem(
        String id,
        String user_email,
        String status,
        boolean escalated,
        String assigned_agent_id,
        int message_count,
        long created_at,
        long last_activity_at
) {
    public static SessionSummaryItem of(ChatSession s) {
        return new SessionSummaryItem(
                s.id(),
                s.userIdentifier(),
                s.status().wireValue(),
                s.escalated(),
                s.assignedAgentId(),
                s.messageCount(),
                s.createdAt().toEpochMilli(),
                s.lastActivityAt().toEpochMilli()
        );
    }
}
