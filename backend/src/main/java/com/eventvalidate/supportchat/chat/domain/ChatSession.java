package com.eventvalidate.supportchat.chat.domain;

import com.eventvalidate.supportchat.chat.error.InvalidStatusTransitionException;
import com.eventvalidate.supportchat.chat.error.SessionClosedException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable snapshot of one support conversation. Every mutation returns a new snapshot.
 *
 * <p>Status moves {@code ACTIVE -> PENDING_AGENT -> ACTIVE(with agent) -> RESOLVED}. An
 * un-escalated active session may also be claimed by an agent directly, and any open session may
 * be resolved. Nothing leaves {@code RESOLVED}.
 */
public record ChatSession(
        String id,
        String userIdentifier,
        String assignedAgentId,
        SessionStatus status,
        boolean escalated,
        List<ChatMessage> messages,
        Instant createdAt,
        Instant lastActivityAt
) {
    public ChatSession {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(lastActivityAt, "lastActivityAt");
        userIdentifier = blankToNull(userIdentifier);
        assignedAgentId = blankToNull(assignedAgentId);
        messages = messages == null ? List.of() : List.copyOf(messages);

        if (status == SessionStatus.PENDING_AGENT && (!escalated || assignedAgentId != null)) {
            throw new IllegalStateException("pending session must be escalated and unassigned: " + id);
        }
        if (status == SessionStatus.ACTIVE && assignedAgentId != null && !escalated) {
            throw new IllegalStateException("assigned session must be escalated: " + id);
        }
    }

    public static ChatSession open(String id, String userIdentifier, Instant now) {
        return new ChatSession(id, userIdentifier, null, SessionStatus.ACTIVE, false, List.of(), now, now);
    }

    public boolean isResolved() {
        return status == SessionStatus.RESOLVED;
    }

    public boolean hasAssignedAgent() {
        return assignedAgentId != null;
    }

    public int messageCount() {
        return messages.size();
    }

    public long lastSeq() {
        return messages.isEmpty() ? 0L : messages.get(messages.size() - 1).seq();
    }

    public Optional<ChatMessage> lastMessage() {
        return messages.isEmpty() ? Optional.empty() : Optional.of(messages.get(messages.size() - 1));
    }

    public List<ChatMessage> messagesAfter(long seq) {
        return messages.stream().filter(m -> m.seq() > seq).toList();
    }

    public ChatSession withMessage(MessageSender sender, String text, Instant now) {
        if (isResolved()) {
            throw new SessionClosedException(id);
        }
        var message = new ChatMessage("m_" + UUID.randomUUID(), id, lastSeq() + 1, text, sender, now);
        var next = new ArrayList<ChatMessage>(messages.size() + 1);
        next.addAll(messages);
        next.add(message);
        return new ChatSession(id, userIdentifier, assignedAgentId, status, escalated, next, createdAt, now);
    }

    public ChatSession withUserIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank() || identifier.equals(userIdentifier)) {
            return this;
        }
        return new ChatSession(id, identifier, assignedAgentId, status, escalated, messages, createdAt, lastActivityAt);
    }

    /**
     * Marks the session as needing a human. An already staffed session keeps its agent and status.
     */
    public ChatSession escalate(Instant now) {
        if (isResolved()) {
            throw new SessionClosedException(id);
        }
        if (status == SessionStatus.ACTIVE && hasAssignedAgent()) {
            return this;
        }
        return transitionTo(SessionStatus.PENDING_AGENT, null, now);
    }

    public ChatSession claim(String agentId, Instant now) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("missing_agent_id");
        }
        return transitionTo(SessionStatus.ACTIVE, agentId, now);
    }

    public ChatSession resolve(Instant now) {
        return transitionTo(SessionStatus.RESOLVED, null, now);
    }

    /**
     * Validated status change. {@code agentId} is only read for {@code ACTIVE}; other targets keep
     * (or, for {@code PENDING_AGENT}, clear) the current assignment.
     */
    public ChatSession transitionTo(SessionStatus target, String agentId, Instant now) {
        Objects.requireNonNull(target, "target");
        if (isResolved()) {
            if (target == SessionStatus.RESOLVED) {
                return this;
            }
            throw new InvalidStatusTransitionException(id, status, target);
        }

        return switch (target) {
            case RESOLVED -> new ChatSession(id, userIdentifier, assignedAgentId, SessionStatus.RESOLVED,
                    escalated, messages, createdAt, now);
            case PENDING_AGENT -> {
                if (status == SessionStatus.ACTIVE && hasAssignedAgent()) {
                    throw new InvalidStatusTransitionException(id, status, target);
                }
                if (status == SessionStatus.PENDING_AGENT) {
                    yield this;
                }
                yield new ChatSession(id, userIdentifier, null, SessionStatus.PENDING_AGENT,
                        true, messages, createdAt, now);
            }
            case ACTIVE -> {
                if (agentId == null || agentId.isBlank()) {
                    if (status == SessionStatus.ACTIVE && !hasAssignedAgent()) {
                        yield this;
                    }
                    throw new InvalidStatusTransitionException(id, status, target);
                }
                yield new ChatSession(id, userIdentifier, agentId, SessionStatus.ACTIVE,
                        true, messages, createdAt, now);
            }
        };
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s;
    }
}
