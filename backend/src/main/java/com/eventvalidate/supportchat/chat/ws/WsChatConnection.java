package com.eventvalidate.supportchat.chat.ws;

import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * {@link ChatConnection} over a Spring {@link WebSocketSession}. Sends go through a
 * {@link ConcurrentWebSocketSessionDecorator}, so router threads for different sessions may
 * write to the same socket concurrently.
 */
public class WsChatConnection implements ChatConnection {

    private final WebSocketSession session;
    private final EnvelopeCodec codec;
    private final String credential;

    public WsChatConnection(WebSocketSession session, EnvelopeCodec codec, String credential,
                            int sendTimeLimitMs, int bufferSizeLimitBytes) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimitBytes);
        this.codec = codec;
        this.credential = credential;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public String credential() {
        return credential;
    }

    @Override
    public void send(OutboundEvent event) throws IOException {
        if (!session.isOpen()) return;
        session.sendMessage(new TextMessage(codec.encode(event)));
    }
}
