package com.eventvalidate.supportchat.chat.ws;

import java.io.IOException;

/**
 * A live transport channel to one user or agent. Owned by {@link ConnectionRegistry}; never
 * persisted.
 */
public interface ChatConnection {

    String id();

    boolean isOpen();

    /**
     * Credential presented when the channel was opened (e.g. a bearer token), or {@code null}.
     */
    String credential();

    void send(OutboundEvent event) throws IOException;
}
