package com.eventvalidate.supportchat.chat.domain;

import java.util.Arrays;

public enum SessionStatus {
    ACTIVE("active"),
    PENDING_AGENT("pending_admin"),
    RESOLVED("resolved");

    private final String wireValue;

    SessionStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public boolean isOpen() {
        return this != RESOLVED;
    }

    public static SessionStatus fromWire(String value) {
        return Arrays.stream(values())
                .filter(s -> s.wireValue.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown_session_status"));
    }
}
