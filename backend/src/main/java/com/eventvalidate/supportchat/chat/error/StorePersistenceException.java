package com.eventvalidate.supportchat.chat.error;

/**
 * The durable write failed or did not finish within the configured timeout. The message was
 * not acknowledged; the sender may retry.
 */
public class StorePersistenceException extends ChatBrokerException {

    public StorePersistenceException(String message, Throwable cause) {
        super("store_unavailable", message, cause);
    }
}
