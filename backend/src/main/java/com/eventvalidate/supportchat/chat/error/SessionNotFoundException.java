package com.eventvalidate.supportchat.chat.error;

public class SessionNotFoundException extends ChatBrokerException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("session_not_found", "chat session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}
