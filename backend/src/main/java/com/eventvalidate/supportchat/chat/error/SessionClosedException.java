package com.eventvalidate.supportchat.chat.error;

/**
 * The session is resolved; it accepts reads only.
 */
public class SessionClosedException extends ChatBrokerException {

    private final String sessionId;

    public SessionClosedException(String sessionId) {
        super("session_closed", "chat session is resolved: " + sessionId);
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}
