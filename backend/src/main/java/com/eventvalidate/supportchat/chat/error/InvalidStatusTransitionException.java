package com.eventvalidate.supportchat.chat.error;

import com.eventvalidate.supportchat.chat.domain.SessionStatus;

public class InvalidStatusTransitionException extends ChatBrokerException {

    public InvalidStatusTransitionException(String sessionId, SessionStatus from, SessionStatus to) {
        super("invalid_status_transition",
                "session " + sessionId + " cannot move from " + from.wireValue() + " to " + to.wireValue());
    }
}
