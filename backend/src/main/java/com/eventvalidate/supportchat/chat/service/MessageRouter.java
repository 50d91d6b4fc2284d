package com.eventvalidate.supportchat.chat.service;

import com.eventvalidate.supportchat.chat.domain.ChatMessage;
import com.eventvalidate.supportchat.chat.domain.ChatSession;
import com.eventvalidate.supportchat.chat.domain.MessageSender;
import com.eventvalidate.supportchat.chat.error.SessionClosedException;
import com.eventvalidate.supportchat.chat.error.SessionNotFoundException;
import com.eventvalidate.supportchat.chat.ws.ChatConnection;
import com.eventvalidate.supportchat.chat.ws.ConnectionRegistry;
import com.eventvalidate.supportchat.chat.ws.OutboundEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Persists inbound chat lines and fans them out to whoever is live.
 *
 * <p>Each call runs inside the session's lock, so persistence, acknowledgement and delivery for
 * one session happen in processing order. Acks go out only after the durable write succeeded.
 */
@Service
public class MessageRouter {

    private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);

    public static final String DELIVERED = "delivered";
    public static final String PENDING = "pending";
    public static final String BOT = "bot";

    private final SessionStore sessionStore;
    private final ConnectionRegistry registry;
    private final BroadcastService broadcastService;

    private final Counter userMessages;
    private final Counter agentMessages;
    private final Counter botMessages;

    public MessageRouter(
            SessionStore sessionStore,
            ConnectionRegistry registry,
            BroadcastService broadcastService,
            MeterRegistry meterRegistry
    ) {
        this.sessionStore = sessionStore;
        this.registry = registry;
        this.broadcastService = broadcastService;
        this.userMessages = routedCounter(meterRegistry, MessageSender.USER);
        this.agentMessages = routedCounter(meterRegistry, MessageSender.AGENT);
        this.botMessages = routedCounter(meterRegistry, MessageSender.BOT);
    }

    /**
     * @return the persisted message, or empty when {@code text} was blank and nothing was stored
     */
    public Optional<ChatMessage> handleUserMessage(ChatConnection origin, String sessionId, String text, String userIdentifier) {
        return sessionStore.withSessionLock(sessionId, () -> {
            var session = sessionStore.loadOrCreate(sessionId, userIdentifier);
            if (session.isResolved()) {
                throw new SessionClosedException(sessionId);
            }
            if (text == null || text.isBlank()) {
                log.debug("chat_user_message_blank sessionId={}", sessionId);
                return Optional.empty();
            }

            var updated = sessionStore.update(sessionId, (s, now) ->
                    s.withUserIdentifier(userIdentifier).withMessage(MessageSender.USER, text, now));
            var message = lastMessageOf(updated);
            userMessages.increment();

            List<ChatConnection> recipients;
            String delivery;
            if (!updated.escalated()) {
                recipients = List.of();
                delivery = BOT;
            } else {
                recipients = updated.hasAssignedAgent()
                        ? registry.agentConnections(updated.assignedAgentId())
                        : registry.allAgentConnections();
                delivery = recipients.isEmpty() ? PENDING : DELIVERED;
            }

            var view = OutboundEvent.MessageView.of(message);
            if (origin != null) {
                broadcastService.sendTo(origin, new OutboundEvent.MessageReceived(view, delivery));
            }
            if (!recipients.isEmpty()) {
                broadcastService.sendToAll(recipients,
                        new OutboundEvent.NewUserMessage(sessionId, updated.userIdentifier(), view));
            } else if (PENDING.equals(delivery)) {
                log.info("chat_user_message_pending sessionId={} assignedAgentId={}", sessionId, updated.assignedAgentId());
            }
            broadcastService.broadcastActiveSessions();
            return Optional.of(message);
        });
    }

    public ChatMessage handleAgentMessage(ChatConnection origin, String sessionId, String text, String agentId) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("missing_text");
        }
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("unauthorized");
        }
        return sessionStore.withSessionLock(sessionId, () -> {
            var canonical = sessionStore.reloadCanonical(sessionId)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));
            if (canonical.isResolved()) {
                throw new SessionClosedException(sessionId);
            }

            var updated = sessionStore.update(sessionId, (s, now) ->
                    s.claim(agentId, now).withMessage(MessageSender.AGENT, text, now));
            var message = lastMessageOf(updated);
            agentMessages.increment();

            var view = OutboundEvent.MessageView.of(message);
            var userConn = registry.lookupUser(sessionId);
            var delivery = userConn.isPresent() ? DELIVERED : PENDING;
            if (origin != null) {
                broadcastService.sendTo(origin, new OutboundEvent.MessageSent(view, delivery));
            }
            userConn.ifPresent(conn -> broadcastService.sendTo(conn, new OutboundEvent.AdminMessage(view)));
            broadcastService.broadcastEvent(OutboundEvent.SessionUpdated.of(updated));
            return message;
        });
    }

    /**
     * Records a reply produced by the automated assistant and pushes it to the user if connected.
     */
    public ChatMessage handleBotMessage(String sessionId, String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("missing_text");
        }
        return sessionStore.withSessionLock(sessionId, () -> {
            var session = sessionStore.loadOrCreate(sessionId, null);
            if (session.isResolved()) {
                throw new SessionClosedException(sessionId);
            }
            var updated = sessionStore.appendMessage(sessionId, MessageSender.BOT, text);
            var message = lastMessageOf(updated);
            botMessages.increment();

            registry.lookupUser(sessionId).ifPresent(conn ->
                    broadcastService.sendTo(conn, new OutboundEvent.BotMessage(OutboundEvent.MessageView.of(message))));
            return message;
        });
    }

    private static ChatMessage lastMessageOf(ChatSession session) {
        return session.lastMessage().orElseThrow(() -> new IllegalStateException("append produced no message"));
    }

    private static Counter routedCounter(MeterRegistry meterRegistry, MessageSender sender) {
        return Counter.builder("chat.messages.routed")
                .description("Chat messages persisted by the router")
                .tag("sender", sender.wireValue())
                .register(meterRegistry);
    }
}
