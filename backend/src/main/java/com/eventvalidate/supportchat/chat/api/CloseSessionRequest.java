package com.eventvalidate.supportchat.chat.api;

public record CloseSessionRequest(
        String admin_id
) {
}
