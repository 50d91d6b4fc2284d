package com.eventvalidate.supportchat.chat.ws;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.util.Arrays;

@Configuration
@EnableWebSocket
public class WsConfig implements WebSocketConfigurer {

    private final WsHandler wsHandler;
    private final String path;
    private final String[] allowedOriginPatterns;

    public WsConfig(
            WsHandler wsHandler,
            @Value("${app.chat.ws.path:/ws/chat}") String path,
            @Value("${app.chat.ws.allowed-origins:*}") String allowedOriginsCsv
    ) {
        this.wsHandler = wsHandler;
        this.path = path;
        this.allowedOriginPatterns = Arrays.stream(allowedOriginsCsv.split(","))
                .map(String::trim)
                .filter(s -> !s.isBlank())
                .toArray(String[]::new);
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(wsHandler, path).setAllowedOriginPatterns(allowedOriginPatterns);
    }
}
