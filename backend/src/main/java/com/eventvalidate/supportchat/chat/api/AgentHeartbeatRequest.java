package com.eventvalidate.supportchat.chat.api;

public record AgentHeartbeatRequest(
        String admin_id
) {
}
