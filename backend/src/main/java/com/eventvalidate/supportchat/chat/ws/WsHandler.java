package com.eventvalidate.supportchat.chat.ws;

import com.eventvalidate.supportchat.chat.error.MalformedEnvelopeException;
import com.eventvalidate.supportchat.chat.service.ChatBroker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class WsHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(WsHandler.class);

    private final ChatBroker broker;
    private final EnvelopeCodec codec;
    private final int sendTimeLimitMs;
    private final int bufferSizeLimitBytes;

    private final Map<String, WsChatConnection> connections = new ConcurrentHashMap<>();

    public WsHandler(
            ChatBroker broker,
            EnvelopeCodec codec,
            @Value("${app.chat.ws.send-time-limit-ms:10000}") int sendTimeLimitMs,
            @Value("${app.chat.ws.buffer-size-limit-bytes:524288}") int bufferSizeLimitBytes
    ) {
        this.broker = broker;
        this.codec = codec;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimitBytes = bufferSizeLimitBytes;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        // Admin clients may pass a bearer token, e.g. /ws/chat?token=...
        var params = parseQueryParams(session.getUri());
        var token = params.get("token");
        var conn = new WsChatConnection(session, codec, token, sendTimeLimitMs, bufferSizeLimitBytes);
        connections.put(session.getId(), conn);
        log.debug("ws_connected sessionId={}", session.getId());
        broker.onConnect(conn);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        var conn = connections.remove(session.getId());
        if (conn != null) {
            broker.onClose(conn);
        }
        log.debug("ws_closed sessionId={} code={}", session.getId(), status.getCode());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("ws_transport_error sessionId={} reason={}", session.getId(), exception.toString());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        final String rid = "ws_" + session.getId() + "_" + System.nanoTime();
        var conn = connections.get(session.getId());
        if (conn == null) {
            log.warn("ws_unknown_connection rid={} sessionId={}", rid, session.getId());
            return;
        }

        var payload = message.getPayload();
        if (payload == null || payload.isBlank()) {
            // keep-alive frames from some clients
            return;
        }

        try {
            var event = codec.decode(payload);
            broker.onEvent(conn, event);
        } catch (MalformedEnvelopeException ex) {
            log.debug("ws_malformed_envelope rid={} sessionId={} payload={}", rid, session.getId(), safeOneLine(payload));
            broker.sendError(conn, ex.code(), null);
        } catch (IllegalArgumentException ex) {
            broker.sendError(conn, ex.getMessage(), null);
        } catch (Exception ex) {
            log.warn("ws_internal_error rid={} sessionId={} payload={}", rid, session.getId(), safeOneLine(payload), ex);
            broker.sendError(conn, "ws_internal_error", null);
        }
    }

    int liveConnectionCount() {
        return connections.size();
    }

    private static Map<String, String> parseQueryParams(URI uri) {
        if (uri == null || uri.getRawQuery() == null || uri.getRawQuery().isBlank()) {
            return Map.of();
        }
        var out = new HashMap<String, String>();
        for (var pair : uri.getRawQuery().split("&")) {
            if (pair == null || pair.isBlank()) continue;
            var idx = pair.indexOf('=');
            var rawKey = idx < 0 ? pair : pair.substring(0, idx);
            var rawVal = idx < 0 ? "" : pair.substring(idx + 1);
            var key = URLDecoder.decode(rawKey, StandardCharsets.UTF_8);
            if (!key.isBlank()) {
                out.put(key, URLDecoder.decode(rawVal, StandardCharsets.UTF_8));
            }
        }
        return out;
    }

    private static String safeOneLine(String s) {
        if (s == null) return "";
        var x = s.replaceAll("[\\r\\n\\t]", " ");
        return x.length() > 500 ? x.substring(0, 500) + "..." : x;
    }
}
