package com.eventvalidate.supportchat.chat.ws;

import com.eventvalidate.supportchat.chat.error.MalformedEnvelopeException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Maps {@code {type, data}} JSON frames to {@link InboundEvent} variants and
 * {@link OutboundEvent}s back to frames.
 */
@Component
public class EnvelopeCodec {

    private final ObjectMapper objectMapper;
    private final int maxTextLength;

    public EnvelopeCodec(
            ObjectMapper objectMapper,
            @Value("${app.chat.max-text-length:10000}") int maxTextLength
    ) {
        this.objectMapper = objectMapper;
        this.maxTextLength = Math.max(1, maxTextLength);
    }

    public InboundEvent decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new MalformedEnvelopeException("empty frame", null);
        }

        final JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException ex) {
            throw new MalformedEnvelopeException("unparseable frame", ex);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedEnvelopeException("frame is not a JSON object", null);
        }

        var type = text(root, "type");
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("missing_type");
        }
        var data = root.path("data");

        return switch (type) {
            case "join_user_session" -> new InboundEvent.JoinUserSession(
                    requireSessionId(data),
                    text(data, "userEmail"));
            case "join_admin_session" -> new InboundEvent.JoinAdminSession(
                    text(data, "adminId"),
                    blankToNull(text(data, "sessionId")));
            case "user_message" -> new InboundEvent.UserMessage(
                    requireSessionId(data),
                    requireText(data),
                    text(data, "userEmail"));
            case "admin_message" -> new InboundEvent.AdminMessage(
                    requireSessionId(data),
                    requireText(data),
                    text(data, "adminId"));
            case "escalate_to_admin" -> new InboundEvent.EscalateToAdmin(
                    requireSessionId(data),
                    text(data, "userEmail"),
                    text(data, "reason"));
            case "ping" -> new InboundEvent.Ping(text(data, "adminId"));
            default -> throw new IllegalArgumentException("unsupported_type");
        };
    }

    public String encode(OutboundEvent event) throws JsonProcessingException {
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put("type", event.type());
        envelope.set("data", objectMapper.valueToTree(event));
        return objectMapper.writeValueAsString(envelope);
    }

    private String requireSessionId(JsonNode data) {
        var sessionId = text(data, "sessionId");
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("missing_session_id");
        }
        return sessionId;
    }

    private String requireText(JsonNode data) {
        var text = text(data, "text");
        if (text == null) {
            throw new IllegalArgumentException("missing_text");
        }
        if (text.length() > maxTextLength) {
            throw new IllegalArgumentException("text_too_long");
        }
        return text;
    }

    private static String text(JsonNode node, String field) {
        var v = node.path(field);
        if (v.isMissingNode() || v.isNull()) return null;
        return v.asText();
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s;
    }
}
