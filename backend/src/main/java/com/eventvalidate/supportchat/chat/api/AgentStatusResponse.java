package com.eventvalidate.supportchat.chat.api;

import java.util.List;

public record AgentStatusResponse(
        boolean online,
        List<String> online_agents,
        int live_connections,
        long online_window_seconds
) {
}
