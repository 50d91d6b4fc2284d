package com.eventvalidate.supportchat.chat.service;

import com.eventvalidate.supportchat.chat.domain.ChatSession;
import com.eventvalidate.supportchat.chat.domain.MessageSender;
import com.eventvalidate.supportchat.chat.domain.SessionStatus;
import com.eventvalidate.supportchat.chat.error.SessionClosedException;
import com.eventvalidate.supportchat.chat.error.SessionNotFoundException;
import com.eventvalidate.supportchat.chat.ws.ChatConnection;
import com.eventvalidate.supportchat.chat.ws.ConnectionRegistry;
import com.eventvalidate.supportchat.chat.ws.OutboundEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives sessions from bot handling to a human agent and on to resolution.
 */
@Service
public class EscalationController {

    private static final Logger log = LoggerFactory.getLogger(EscalationController.class);

    static final String CONFIRMATION =
            "Your request has been forwarded to our support team. A human agent will assist you shortly.";

    private final SessionStore sessionStore;
    private final ConnectionRegistry registry;
    private final BroadcastService broadcastService;
    private final AgentPresenceService agentPresenceService;

    public EscalationController(
            SessionStore sessionStore,
            ConnectionRegistry registry,
            BroadcastService broadcastService,
            AgentPresenceService agentPresenceService
    ) {
        this.sessionStore = sessionStore;
        this.registry = registry;
        this.broadcastService = broadcastService;
        this.agentPresenceService = agentPresenceService;
    }

    /**
     * Requests a human agent. A session that already has an agent keeps it; the reason is still
     * recorded in the transcript.
     */
    public ChatSession escalate(ChatConnection origin, String sessionId, String userIdentifier, String reason) {
        var effectiveReason = (reason == null || reason.isBlank()) ? "not specified" : reason.trim();
        return sessionStore.withSessionLock(sessionId, () -> {
            var session = sessionStore.loadOrCreate(sessionId, userIdentifier);
            if (session.isResolved()) {
                throw new SessionClosedException(sessionId);
            }

            var updated = sessionStore.update(sessionId, (s, now) -> s
                    .withUserIdentifier(userIdentifier)
                    .escalate(now)
                    .withMessage(MessageSender.USER, "User requested human support. Reason: " + effectiveReason, now));
            log.info("chat_escalated sessionId={} status={} assignedAgentId={}",
                    sessionId, updated.status().wireValue(), updated.assignedAgentId());

            var request = new OutboundEvent.EscalationRequest(sessionId, updated.userIdentifier(), effectiveReason,
                    updated.lastActivityAt().toEpochMilli());
            var reached = broadcastService.broadcastEvent(request);
            if (reached == 0) {
                log.info("chat_escalation_no_agent_online sessionId={}", sessionId);
            }
            broadcastService.broadcastActiveSessions();

            if (origin != null) {
                broadcastService.sendTo(origin, new OutboundEvent.EscalationConfirmed(sessionId, CONFIRMATION));
            }
            return updated;
        });
    }

    /**
     * Registers an agent connection and, when a session id is given, claims that session for the
     * agent using the durable record as the starting point. Resolved sessions are returned
     * read-only. The agent always receives the current active-session list.
     */
    public ChatSession joinSession(ChatConnection origin, String agentId, String sessionId) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("unauthorized");
        }
        registry.registerAgent(agentId, origin);
        agentPresenceService.markSeen(agentId);

        ChatSession joined = null;
        if (sessionId != null && !sessionId.isBlank()) {
            joined = sessionStore.withSessionLock(sessionId, () -> {
                var canonical = sessionStore.reloadCanonical(sessionId)
                        .orElseThrow(() -> new SessionNotFoundException(sessionId));
                if (canonical.isResolved()) {
                    return canonical;
                }
                var claimed = sessionStore.updateStatus(sessionId, SessionStatus.ACTIVE, agentId);
                log.info("chat_agent_joined sessionId={} agentId={}", sessionId, agentId);
                return claimed;
            });
            if (origin != null) {
                broadcastService.sendTo(origin, OutboundEvent.SessionData.of(joined));
            }
            if (!joined.isResolved()) {
                broadcastService.broadcastActiveSessions();
            }
        }

        if (origin != null) {
            broadcastService.sendTo(origin, OutboundEvent.ActiveSessions.of(sessionStore.listActiveSessions()));
        }
        return joined;
    }

    public ChatSession close(String sessionId, String agentId) {
        return sessionStore.withSessionLock(sessionId, () -> {
            var session = sessionStore.loadSession(sessionId)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));
            if (session.isResolved()) {
                return session;
            }

            var resolved = sessionStore.updateStatus(sessionId, SessionStatus.RESOLVED, null);
            if (agentId != null && !agentId.isBlank()) {
                agentPresenceService.markSeen(agentId);
            }
            log.info("chat_session_resolved sessionId={} agentId={}", sessionId, agentId);

            registry.lookupUser(sessionId).ifPresent(conn ->
                    broadcastService.sendTo(conn, new OutboundEvent.SessionClosed(sessionId, agentId)));
            broadcastService.broadcastActiveSessions();
            return resolved;
        });
    }
}
