package com.eventvalidate.supportchat.chat.ws;

import com.eventvalidate.supportchat.chat.domain.ChatMessage;
import com.eventvalidate.supportchat.chat.domain.ChatSession;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Outbound envelope payloads. {@link #type()} becomes the envelope {@code type}; the record
 * itself is serialized as {@code data}.
 */
public sealed interface OutboundEvent {

    String type();

    record MessageView(String id, String sessionId, long seq, String text, String sender, long timestamp) {
        public static MessageView of(ChatMessage m) {
            return new MessageView(m.id(), m.sessionId(), m.seq(), m.text(), m.sender().wireValue(),
                    m.timestamp().toEpochMilli());
        }
    }

    record SessionSummary(
            String id,
            String userEmail,
            @JsonProperty("isEscalated") boolean escalated,
            String status,
            String assignedAgentId,
            long lastActivity,
            int messageCount
    ) {
        public static SessionSummary of(ChatSession s) {
            return new SessionSummary(s.id(), s.userIdentifier(), s.escalated(), s.status().wireValue(),
                    s.assignedAgentId(), s.lastActivityAt().toEpochMilli(), s.messageCount());
        }
    }

    record Connected(String message) implements OutboundEvent {
        public String type() {
            return "connected";
        }
    }

    record SessionData(
            String sessionId,
            String userEmail,
            String status,
            @JsonProperty("isEscalated") boolean escalated,
            String assignedAgentId,
            List<MessageView> messages
    ) implements OutboundEvent {
        public static SessionData of(ChatSession s) {
            return new SessionData(s.id(), s.userIdentifier(), s.status().wireValue(), s.escalated(),
                    s.assignedAgentId(), s.messages().stream().map(MessageView::of).toList());
        }

        public String type() {
            return "session_data";
        }
    }

    record ActiveSessions(@JsonValue List<SessionSummary> sessions) implements OutboundEvent {
        public static ActiveSessions of(List<ChatSession> sessions) {
            return new ActiveSessions(sessions.stream().map(SessionSummary::of).toList());
        }

        public String type() {
            return "active_sessions";
        }
    }

    record NewUserMessage(String sessionId, String userEmail, MessageView message) implements OutboundEvent {
        public String type() {
            return "new_user_message";
        }
    }

    /**
     * Ack to an agent. {@code delivery} is {@code delivered} when the user had a live channel,
     * {@code pending} otherwise.
     */
    record MessageSent(MessageView message, String delivery) implements OutboundEvent {
        public String type() {
            return "message_sent";
        }
    }

    /**
     * Ack to a user. {@code delivery} is {@code delivered}, {@code pending} (no agent online) or
     * {@code bot} (not escalated).
     */
    record MessageReceived(MessageView message, String delivery) implements OutboundEvent {
        public String type() {
            return "message_received";
        }
    }

    record AdminMessage(MessageView message) implements OutboundEvent {
        public String type() {
            return "admin_message";
        }
    }

    record BotMessage(MessageView message) implements OutboundEvent {
        public String type() {
            return "bot_message";
        }
    }

    record EscalationRequest(String sessionId, String userEmail, String reason, long timestamp) implements OutboundEvent {
        public String type() {
            return "escalation_request";
        }
    }

    record EscalationConfirmed(String sessionId, String message) implements OutboundEvent {
        public String type() {
            return "escalation_confirmed";
        }
    }

    record SessionUpdated(
            String sessionId,
            String status,
            String assignedAgentId,
            long lastActivity,
            int messageCount
    ) implements OutboundEvent {
        public static SessionUpdated of(ChatSession s) {
            return new SessionUpdated(s.id(), s.status().wireValue(), s.assignedAgentId(),
                    s.lastActivityAt().toEpochMilli(), s.messageCount());
        }

        public String type() {
            return "session_updated";
        }
    }

    record SessionClosed(String sessionId, String closedBy) implements OutboundEvent {
        public String type() {
            return "session_closed";
        }
    }

    record Pong(long serverTime) implements OutboundEvent {
        public String type() {
            return "pong";
        }
    }

    record ErrorEvent(String code, String message) implements OutboundEvent {
        public String type() {
            return "error";
        }
    }
}
