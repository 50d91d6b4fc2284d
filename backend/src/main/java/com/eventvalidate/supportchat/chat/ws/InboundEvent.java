package com.eventvalidate.supportchat.chat.ws;

/**
 * Decoded inbound envelope, one variant per {@code type}.
 */
public sealed interface InboundEvent {

    record JoinUserSession(String sessionId, String userEmail) implements InboundEvent {
    }

    record JoinAdminSession(String adminId, String sessionId) implements InboundEvent {
    }

    record UserMessage(String sessionId, String text, String userEmail) implements InboundEvent {
    }

    record AdminMessage(String sessionId, String text, String adminId) implements InboundEvent {
    }

    record EscalateToAdmin(String sessionId, String userEmail, String reason) implements InboundEvent {
    }

    record Ping(String adminId) implements InboundEvent {
    }
}
