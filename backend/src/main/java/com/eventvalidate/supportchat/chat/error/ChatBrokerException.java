package com.eventvalidate.supportchat.chat.error;

/**
 * Base type for failures on a single message path. {@link #code()} is the stable value clients
 * receive in {@code error} envelopes and REST error bodies.
 */
public abstract class ChatBrokerException extends RuntimeException {

    private final String code;

    protected ChatBrokerException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected ChatBrokerException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
