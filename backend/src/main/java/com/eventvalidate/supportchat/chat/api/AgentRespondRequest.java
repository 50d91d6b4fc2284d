package com.eventvalidate.supportchat.chat.api;

import jakarta.validation.constraints.NotBlank;

public record AgentRespondRequest(
        @NotBlank(message = "missing_text") String text,
        String admin_id
) {
}
