package com.eventvalidate.supportchat.chat.service;

import com.eventvalidate.supportchat.chat.ws.ChatConnection;
import com.eventvalidate.supportchat.chat.ws.ConnectionRegistry;
import com.eventvalidate.supportchat.chat.ws.OutboundEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Collection;

/**
 * Best-effort fan-out to live connections: at most once per connection registered at the time of
 * the call. A connection closing mid-iteration may miss the event; admin clients reload full
 * state on (re)join.
 */
@Service
public class BroadcastService {

    private static final Logger log = LoggerFactory.getLogger(BroadcastService.class);

    private final ConnectionRegistry registry;
    private final SessionStore sessionStore;

    public BroadcastService(ConnectionRegistry registry, SessionStore sessionStore) {
        this.registry = registry;
        this.sessionStore = sessionStore;
    }

    public int broadcastActiveSessions() {
        return broadcastEvent(OutboundEvent.ActiveSessions.of(sessionStore.listActiveSessions()));
    }

    public int broadcastEvent(OutboundEvent event) {
        return sendToAll(registry.allAgentConnections(), event);
    }

    public int sendToAll(Collection<ChatConnection> connections, OutboundEvent event) {
        int reached = 0;
        for (var conn : connections) {
            if (sendTo(conn, event)) {
                reached++;
            }
        }
        return reached;
    }

    public boolean sendTo(ChatConnection conn, OutboundEvent event) {
        if (conn == null || event == null || !conn.isOpen()) {
            return false;
        }
        try {
            conn.send(event);
            return true;
        } catch (IOException | RuntimeException ex) {
            log.debug("ws_send_failed connectionId={} type={} reason={}", conn.id(), event.type(), ex.toString());
            return false;
        }
    }
}
