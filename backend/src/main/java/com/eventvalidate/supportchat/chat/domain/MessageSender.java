package com.eventvalidate.supportchat.chat.domain;

import java.util.Arrays;

public enum MessageSender {
    USER("user"),
    AGENT("admin"),
    BOT("bot");

    private final String wireValue;

    MessageSender(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static MessageSender fromWire(String value) {
        return Arrays.stream(values())
                .filter(s -> s.wireValue.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown_message_sender"));
    }
}
