package com.eventvalidate.supportchat.chat.api;

import jakarta.validation.constraints.NotBlank;

public record UserEscalateRequest(
        @NotBlank(message = "missing_session_id") String session_id,
        String user_email,
        String reason
) {
}
