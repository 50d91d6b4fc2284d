package com.eventvalidate.supportchat.chat.api;

import jakarta.validation.constraints.NotBlank;

public record UserMessageRequest(
        @NotBlank(message = "missing_session_id") String session_id,
        @NotBlank(message = "missing_text") String text,
        String user_email
) {
}
