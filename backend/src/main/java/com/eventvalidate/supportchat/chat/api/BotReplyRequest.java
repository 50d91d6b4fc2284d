package com.eventvalidate.supportchat.chat.api;

import jakarta.validation.constraints.NotBlank;

public record BotReplyRequest(
        @NotBlank(message = "missing_text") String text
) {
}
