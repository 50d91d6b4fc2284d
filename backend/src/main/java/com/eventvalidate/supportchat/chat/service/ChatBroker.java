package com.eventvalidate.supportchat.chat.service;

import com.eventvalidate.supportchat.auth.service.AgentIdentityProvider;
import com.eventvalidate.supportchat.chat.domain.ChatMessage;
import com.eventvalidate.supportchat.chat.domain.ChatSession;
import com.eventvalidate.supportchat.chat.error.ChatBrokerException;
import com.eventvalidate.supportchat.chat.error.SessionNotFoundException;
import com.eventvalidate.supportchat.chat.ws.ChatConnection;
import com.eventvalidate.supportchat.chat.ws.ConnectionRegistry;
import com.eventvalidate.supportchat.chat.ws.InboundEvent;
import com.eventvalidate.supportchat.chat.ws.OutboundEvent;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for the transport listener and for REST fallbacks. Owns no state of its own; it
 * wires the connection registry, session store, router and escalation controller together.
 *
 * <p>Errors on one inbound event are reported on the originating connection as an {@code error}
 * envelope and never close it.
 */
@Service
public class ChatBroker {

    private static final Logger log = LoggerFactory.getLogger(ChatBroker.class);

    private final ConnectionRegistry registry;
    private final SessionStore sessionStore;
    private final MessageRouter messageRouter;
    private final EscalationController escalationController;
    private final BroadcastService broadcastService;
    private final AgentPresenceService agentPresenceService;
    private final AgentIdentityProvider identityProvider;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public ChatBroker(
            ConnectionRegistry registry,
            SessionStore sessionStore,
            MessageRouter messageRouter,
            EscalationController escalationController,
            BroadcastService broadcastService,
            AgentPresenceService agentPresenceService,
            AgentIdentityProvider identityProvider,
            MeterRegistry meterRegistry,
            Clock clock
    ) {
        this.registry = registry;
        this.sessionStore = sessionStore;
        this.messageRouter = messageRouter;
        this.escalationController = escalationController;
        this.broadcastService = broadcastService;
        this.agentPresenceService = agentPresenceService;
        this.identityProvider = identityProvider;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public void onConnect(ChatConnection conn) {
        broadcastService.sendTo(conn, new OutboundEvent.Connected("WebSocket connected"));
    }

    public void onClose(ChatConnection conn) {
        registry.agentIdOf(conn).ifPresent(agentPresenceService::markSeen);
        registry.unregister(conn);
    }

    public void onEvent(ChatConnection conn, InboundEvent event) {
        try {
            dispatch(conn, event);
        } catch (ChatBrokerException ex) {
            meterRegistry.counter("chat.events.rejected", "code", ex.code()).increment();
            log.info("chat_event_rejected connectionId={} event={} code={}",
                    conn.id(), event.getClass().getSimpleName(), ex.code());
            sendError(conn, ex.code(), null);
        } catch (IllegalArgumentException ex) {
            meterRegistry.counter("chat.events.rejected", "code", String.valueOf(ex.getMessage())).increment();
            sendError(conn, ex.getMessage(), null);
        }
    }

    public void sendError(ChatConnection conn, String code, String message) {
        broadcastService.sendTo(conn, new OutboundEvent.ErrorEvent(code, message == null ? describe(code) : message));
    }

    private void dispatch(ChatConnection conn, InboundEvent event) {
        if (event instanceof InboundEvent.JoinUserSession e) {
            joinUser(conn, e);
        } else if (event instanceof InboundEvent.JoinAdminSession e) {
            var agentId = requireAgent(conn, e.adminId());
            escalationController.joinSession(conn, agentId, e.sessionId());
        } else if (event instanceof InboundEvent.UserMessage e) {
            bindUser(conn, e.sessionId());
            messageRouter.handleUserMessage(conn, e.sessionId(), e.text(), e.userEmail());
        } else if (event instanceof InboundEvent.AdminMessage e) {
            var agentId = requireAgent(conn, e.adminId());
            registry.registerAgent(agentId, conn);
            agentPresenceService.markSeen(agentId);
            messageRouter.handleAgentMessage(conn, e.sessionId(), e.text(), agentId);
        } else if (event instanceof InboundEvent.EscalateToAdmin e) {
            bindUser(conn, e.sessionId());
            escalationController.escalate(conn, e.sessionId(), e.userEmail(), e.reason());
        } else if (event instanceof InboundEvent.Ping) {
            registry.agentIdOf(conn).ifPresent(agentPresenceService::markSeen);
            broadcastService.sendTo(conn, new OutboundEvent.Pong(clock.millis()));
        }
    }

    private void joinUser(ChatConnection conn, InboundEvent.JoinUserSession e) {
        registry.registerUser(e.sessionId(), conn);
        var session = sessionStore.withSessionLock(e.sessionId(), () -> {
            var current = sessionStore.loadOrCreate(e.sessionId(), e.userEmail());
            if (current.isResolved() || e.userEmail() == null || e.userEmail().equals(current.userIdentifier())) {
                return current;
            }
            return sessionStore.update(e.sessionId(), (s, now) -> s.withUserIdentifier(e.userEmail()));
        });
        broadcastService.sendTo(conn, OutboundEvent.SessionData.of(session));
        broadcastService.sendTo(conn, new OutboundEvent.Connected("WebSocket connection established"));
    }

    private void bindUser(ChatConnection conn, String sessionId) {
        var current = registry.lookupUser(sessionId);
        if (current.isEmpty() || !current.get().id().equals(conn.id())) {
            registry.registerUser(sessionId, conn);
        }
    }

    private String requireAgent(ChatConnection conn, String claimedAgentId) {
        return identityProvider.resolveAgentId(conn.credential(), claimedAgentId)
                .or(() -> registry.agentIdOf(conn))
                .orElseThrow(() -> new IllegalArgumentException("unauthorized"));
    }

    // ---- synchronous reads and REST fallbacks ----

    public Optional<ChatSession> getSession(String sessionId) {
        return sessionStore.loadSession(sessionId);
    }

    public List<ChatSession> listActiveSessions() {
        return sessionStore.listActiveSessions();
    }

    /**
     * Missed-message recovery: messages with {@code seq > afterSeq}, read from the durable record.
     */
    public List<ChatMessage> messagesSince(String sessionId, long afterSeq) {
        var session = sessionStore.reloadCanonical(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        return session.messagesAfter(afterSeq);
    }

    public ChatMessage agentReply(String sessionId, String text, String agentId) {
        agentPresenceService.markSeen(agentId);
        return messageRouter.handleAgentMessage(null, sessionId, text, agentId);
    }

    /**
     * User message sent over HTTP. Unlike the socket path the session must already exist.
     */
    public Optional<ChatMessage> userMessage(String sessionId, String text, String userIdentifier) {
        sessionStore.loadSession(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
        return messageRouter.handleUserMessage(null, sessionId, text, userIdentifier);
    }

    public ChatSession escalate(String sessionId, String userIdentifier, String reason) {
        return escalationController.escalate(null, sessionId, userIdentifier, reason);
    }

    public ChatMessage botReply(String sessionId, String text) {
        return messageRouter.handleBotMessage(sessionId, text);
    }

    public ChatSession close(String sessionId, String agentId) {
        return escalationController.close(sessionId, agentId);
    }

    public static String describe(String code) {
        if (code == null || code.isBlank()) return "error";
        return switch (code) {
            case "malformed_envelope" -> "invalid message format";
            case "missing_type" -> "missing field: type";
            case "unsupported_type" -> "unknown message type";
            case "missing_session_id" -> "missing field: data.sessionId";
            case "missing_text" -> "missing field: data.text";
            case "text_too_long" -> "message text too long";
            case "session_not_found" -> "session not found";
            case "session_closed" -> "this support session has been closed";
            case "invalid_status_transition" -> "invalid session status change";
            case "store_unavailable" -> "message could not be saved, please retry";
            case "unauthorized" -> "unauthorized";
            case "ws_internal_error" -> "internal websocket error";
            default -> code;
        };
    }
}
