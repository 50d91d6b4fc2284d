package com.eventvalidate.supportchat.chat.service;

import com.eventvalidate.supportchat.chat.ws.ConnectionRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks when agents were last active. An agent counts as online while it holds a live
 * connection or was seen within the online window.
 */
@Service
public class AgentPresenceService {

    private final ConnectionRegistry registry;
    private final Clock clock;
    private final Duration onlineWindow;

    private final Map<String, Instant> lastSeen = new ConcurrentHashMap<>();

    public AgentPresenceService(
            ConnectionRegistry registry,
            Clock clock,
            @Value("${app.chat.presence.online-window-seconds:300}") long onlineWindowSeconds
    ) {
        this.registry = registry;
        this.clock = clock;
        this.onlineWindow = Duration.ofSeconds(Math.max(1, onlineWindowSeconds));
    }

    public void markSeen(String agentId) {
        if (agentId == null || agentId.isBlank()) return;
        lastSeen.put(agentId, Instant.now(clock));
    }

    public Set<String> onlineAgents() {
        var cutoff = Instant.now(clock).minus(onlineWindow);
        var out = new TreeSet<String>(registry.connectedAgentIds());
        lastSeen.forEach((agentId, seenAt) -> {
            if (seenAt.isAfter(cutoff)) {
                out.add(agentId);
            }
        });
        return out;
    }

    public boolean isAnyAgentOnline() {
        return !onlineAgents().isEmpty();
    }

    /**
     * Forgets agents not seen within the online window.
     */
    public int sweepStale() {
        var cutoff = Instant.now(clock).minus(onlineWindow);
        int removed = 0;
        for (var e : lastSeen.entrySet()) {
            if (!e.getValue().isAfter(cutoff) && lastSeen.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    public long onlineWindowSeconds() {
        return onlineWindow.getSeconds();
    }
}
