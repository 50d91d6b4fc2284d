package com.eventvalidate.supportchat.chat.error;

public class MalformedEnvelopeException extends ChatBrokerException {

    public MalformedEnvelopeException(String message, Throwable cause) {
        super("malformed_envelope", message, cause);
    }
}
