package com.eventvalidate.supportchat.chat.api;

import com.eventvalidate.supportchat.chat.error.SessionNotFoundException;
import com.eventvalidate.supportchat.chat.service.ChatBroker;
import com.eventvalidate.supportchat.common.api.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/support/sessions")
public class SupportSessionController {

    private final ChatBroker broker;
    private final AgentRequestAuth agentRequestAuth;

    public SupportSessionController(ChatBroker broker, AgentRequestAuth agentRequestAuth) {
        this.broker = broker;
        this.agentRequestAuth = agentRequestAuth;
    }

    @GetMapping
    public ApiResponse<List<SessionSummaryItem>> list(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @RequestParam(name = "admin_id", required = false) String adminId
    ) {
        agentRequestAuth.requireAgentId(authorization, adminId);
        var items = broker.listActiveSessions().stream().map(SessionSummaryItem::of).toList();
        return ApiResponse.ok(items);
    }

    @GetMapping("/{id}")
    public ApiResponse<SessionDetailResponse> get(@PathVariable("id") String id) {
        var session = broker.getSession(id).orElseThrow(() -> new SessionNotFoundException(id));
        return ApiResponse.ok(SessionDetailResponse.of(session));
    }

    /**
     * Messages with a sequence number above {@code after_seq}, for clients recovering after a
     * dropped connection.
     */
    @GetMapping("/{id}/messages")
    public ApiResponse<List<MessageItem>> messages(
            @PathVariable("id") String id,
            @RequestParam(name = "after_seq", required = false, defaultValue = "0") long afterSeq
    ) {
        if (afterSeq < 0) {
            throw new IllegalArgumentException("invalid_after_seq");
        }
        var items = broker.messagesSince(id, afterSeq).stream().map(MessageItem::of).toList();
        return ApiResponse.ok(items);
    }

    @PostMapping("/{id}/respond")
    public ApiResponse<MessageItem> respond(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @PathVariable("id") String id,
            @Valid @RequestBody AgentRespondRequest req
    ) {
        var agentId = agentRequestAuth.requireAgentId(authorization, req.admin_id());
        var message = broker.agentReply(id, req.text(), agentId);
        return ApiResponse.ok(MessageItem.of(message));
    }

    @PostMapping("/{id}/close")
    public ApiResponse<SessionSummaryItem> close(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @PathVariable("id") String id,
            @RequestBody(required = false) CloseSessionRequest req
    ) {
        var agentId = agentRequestAuth.requireAgentId(authorization, req == null ? null : req.admin_id());
        var session = broker.close(id, agentId);
        return ApiResponse.ok(SessionSummaryItem.of(session));
    }

    @PostMapping("/{id}/bot-reply")
    public ApiResponse<MessageItem> botReply(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @PathVariable("id") String id,
            @Valid @RequestBody BotReplyRequest req
    ) {
        agentRequestAuth.requireBotService(authorization);
        var message = broker.botReply(id, req.text());
        return ApiResponse.ok(MessageItem.of(message));
    }
}
