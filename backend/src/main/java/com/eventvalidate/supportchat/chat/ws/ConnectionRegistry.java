package com.eventvalidate.supportchat.chat.ws;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Live connections by session id (user side) and agent id (admin side).
 *
 * <p>A session has at most one user connection; registering another one evicts the old handle
 * without closing it. An agent may hold several connections (one per admin tab). Each connection
 * is bound to at most one key, so {@link #unregister} is a single reverse-index lookup.
 */
@Component
public class ConnectionRegistry {

    private enum Side {USER, AGENT}

    private record Binding(Side side, String key, ChatConnection connection) {
    }

    private final Object monitor = new Object();

    private final Map<String, ChatConnection> userBySession = new HashMap<>();
    private final Map<String, LinkedHashMap<String, ChatConnection>> agentTabs = new HashMap<>();
    private final Map<String, Binding> bindingByConnection = new HashMap<>();

    public void registerUser(String sessionId, ChatConnection conn) {
        if (sessionId == null || sessionId.isBlank() || conn == null) return;
        synchronized (monitor) {
            detach(conn.id());
            var evicted = userBySession.put(sessionId, conn);
            if (evicted != null && !evicted.id().equals(conn.id())) {
                bindingByConnection.remove(evicted.id());
            }
            bindingByConnection.put(conn.id(), new Binding(Side.USER, sessionId, conn));
        }
    }

    public void registerAgent(String agentId, ChatConnection conn) {
        if (agentId == null || agentId.isBlank() || conn == null) return;
        synchronized (monitor) {
            var current = bindingByConnection.get(conn.id());
            if (current != null && current.side() == Side.AGENT && current.key().equals(agentId)) {
                return;
            }
            detach(conn.id());
            agentTabs.computeIfAbsent(agentId, k -> new LinkedHashMap<>()).put(conn.id(), conn);
            bindingByConnection.put(conn.id(), new Binding(Side.AGENT, agentId, conn));
        }
    }

    public void unregister(ChatConnection conn) {
        if (conn == null) return;
        synchronized (monitor) {
            detach(conn.id());
        }
    }

    public Optional<ChatConnection> lookupUser(String sessionId) {
        if (sessionId == null) return Optional.empty();
        synchronized (monitor) {
            var conn = userBySession.get(sessionId);
            return (conn != null && conn.isOpen()) ? Optional.of(conn) : Optional.empty();
        }
    }

    /**
     * The most recently registered live connection of the agent.
     */
    public Optional<ChatConnection> lookupAgent(String agentId) {
        var tabs = agentConnections(agentId);
        return tabs.isEmpty() ? Optional.empty() : Optional.of(tabs.get(tabs.size() - 1));
    }

    public List<ChatConnection> agentConnections(String agentId) {
        if (agentId == null) return List.of();
        synchronized (monitor) {
            var tabs = agentTabs.get(agentId);
            if (tabs == null) return List.of();
            return tabs.values().stream().filter(ChatConnection::isOpen).toList();
        }
    }

    public List<ChatConnection> allAgentConnections() {
        synchronized (monitor) {
            var out = new ArrayList<ChatConnection>();
            for (var tabs : agentTabs.values()) {
                for (var conn : tabs.values()) {
                    if (conn.isOpen()) out.add(conn);
                }
            }
            return out;
        }
    }

    public Optional<String> agentIdOf(ChatConnection conn) {
        if (conn == null) return Optional.empty();
        synchronized (monitor) {
            var b = bindingByConnection.get(conn.id());
            return (b != null && b.side() == Side.AGENT) ? Optional.of(b.key()) : Optional.empty();
        }
    }

    public Optional<String> sessionIdOf(ChatConnection conn) {
        if (conn == null) return Optional.empty();
        synchronized (monitor) {
            var b = bindingByConnection.get(conn.id());
            return (b != null && b.side() == Side.USER) ? Optional.of(b.key()) : Optional.empty();
        }
    }

    public Set<String> connectedAgentIds() {
        synchronized (monitor) {
            return Set.copyOf(agentTabs.keySet());
        }
    }

    private void detach(String connectionId) {
        var b = bindingByConnection.remove(connectionId);
        if (b == null) return;
        if (b.side() == Side.USER) {
            userBySession.remove(b.key(), b.connection());
        } else {
            var tabs = agentTabs.get(b.key());
            if (tabs != null) {
                tabs.remove(connectionId);
                if (tabs.isEmpty()) {
                    agentTabs.remove(b.key());
                }
            }
        }
    }
}
