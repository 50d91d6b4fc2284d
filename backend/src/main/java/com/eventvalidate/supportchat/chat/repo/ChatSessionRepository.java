package com.eventvalidate.supportchat.chat.repo;

import com.eventvalidate.supportchat.chat.domain.ChatSession;

import java.util.List;
import java.util.Optional;

/**
 * Durable record of chat sessions. Implementations must give read-your-writes consistency:
 * a {@link #loadById} after a successful {@link #save} returns that state or a newer one.
 */
public interface ChatSessionRepository {

    Optional<ChatSession> loadById(String id);

    /**
     * Upsert of the session row. Messages are append-only; rows already stored are left untouched.
     *
     * @throws org.springframework.dao.OptimisticLockingFailureException when the stored messages
     *         are not a prefix of {@code session}'s messages
     */
    void save(ChatSession session);

    /**
     * Sessions that are not resolved, with their messages.
     */
    List<ChatSession> findOpen();
}
