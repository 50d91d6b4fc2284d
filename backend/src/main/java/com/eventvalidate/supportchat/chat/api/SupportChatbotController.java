package com.eventvalidate.supportchat.chat.api;

import com.eventvalidate.supportchat.chat.service.ChatBroker;
import com.eventvalidate.supportchat.common.api.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP fallbacks for the user side of a chat, for clients without a live socket.
 */
@RestController
@RequestMapping("/api/v1/support/chatbot")
public class SupportChatbotController {

    private final ChatBroker broker;

    public SupportChatbotController(ChatBroker broker) {
        this.broker = broker;
    }

    @PostMapping("/escalate")
    public ApiResponse<SessionSummaryItem> escalate(@Valid @RequestBody UserEscalateRequest req) {
        var session = broker.escalate(req.session_id(), req.user_email(), req.reason());
        return ApiResponse.ok(SessionSummaryItem.of(session));
    }

    @PostMapping("/send-to-admin")
    public ApiResponse<MessageItem> sendToAdmin(@Valid @RequestBody UserMessageRequest req) {
        var message = broker.userMessage(req.session_id(), req.text(), req.user_email())
                .orElseThrow(() -> new IllegalArgumentException("missing_text"));
        return ApiResponse.ok(MessageItem.of(message));
    }
}
