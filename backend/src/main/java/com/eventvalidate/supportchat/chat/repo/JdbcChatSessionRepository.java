package com.eventvalidate.supportchat.chat.repo;

import com.eventvalidate.supportchat.chat.domain.ChatMessage;
import com.eventvalidate.supportchat.chat.domain.ChatSession;
import com.eventvalidate.supportchat.chat.domain.MessageSender;
import com.eventvalidate.supportchat.chat.domain.SessionStatus;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class JdbcChatSessionRepository implements ChatSessionRepository {

    private record SessionRow(
            String id,
            String userIdentifier,
            String assignedAgentId,
            String status,
            boolean escalated,
            Timestamp createdAt,
            Timestamp lastActivityAt
    ) {
    }

    private static final RowMapper<SessionRow> SESSION_ROW = (rs, rowNum) -> new SessionRow(
            rs.getString("id"),
            rs.getString("user_identifier"),
            rs.getString("assigned_agent_id"),
            rs.getString("status"),
            rs.getBoolean("escalated"),
            rs.getTimestamp("created_at"),
            rs.getTimestamp("last_activity_at")
    );

    private static final RowMapper<ChatMessage> MESSAGE_ROW = (rs, rowNum) -> new ChatMessage(
            rs.getString("id"),
            rs.getString("session_id"),
            rs.getLong("seq"),
            rs.getString("text_content"),
            MessageSender.fromWire(rs.getString("sender")),
            rs.getTimestamp("created_at").toInstant()
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcChatSessionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<ChatSession> loadById(String id) {
        var sql = """
                select id, user_identifier, assigned_agent_id, status, escalated, created_at, last_activity_at
                from chat_session
                where id = ?
                """;
        var rows = jdbcTemplate.query(sql, SESSION_ROW, id);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toSession(rows.get(0), listMessages(id)));
    }

    @Override
    @Transactional
    public void save(ChatSession session) {
        var updated = jdbcTemplate.update("""
                        update chat_session
                        set user_identifier = ?, assigned_agent_id = ?, status = ?, escalated = ?, last_activity_at = ?
                        where id = ?
                        """,
                session.userIdentifier(),
                session.assignedAgentId(),
                session.status().wireValue(),
                session.escalated(),
                Timestamp.from(session.lastActivityAt()),
                session.id()
        );
        if (updated == 0) {
            jdbcTemplate.update("""
                            insert into chat_session(
                                id, user_identifier, assigned_agent_id, status, escalated, created_at, last_activity_at
                            ) values (?, ?, ?, ?, ?, ?, ?)
                            """,
                    session.id(),
                    session.userIdentifier(),
                    session.assignedAgentId(),
                    session.status().wireValue(),
                    session.escalated(),
                    Timestamp.from(session.createdAt()),
                    Timestamp.from(session.lastActivityAt())
            );
        }

        Long storedSeq = jdbcTemplate.queryForObject(
                "select coalesce(max(seq), 0) from chat_message where session_id = ?",
                Long.class,
                session.id()
        );
        var fromSeq = storedSeq == null ? 0L : storedSeq;
        requireSameHistory(session, fromSeq);
        var pending = session.messagesAfter(fromSeq);
        if (pending.isEmpty()) {
            return;
        }

        var batch = new ArrayList<Object[]>(pending.size());
        for (var m : pending) {
            batch.add(new Object[]{
                    m.id(),
                    m.sessionId(),
                    m.seq(),
                    m.sender().wireValue(),
                    m.text(),
                    Timestamp.from(m.timestamp())
            });
        }
        jdbcTemplate.batchUpdate("""
                insert into chat_message(id, session_id, seq, sender, text_content, created_at)
                values (?, ?, ?, ?, ?, ?)
                """, batch);
    }

    /**
     * The snapshot must extend what is stored: it may not know fewer messages, and its message at
     * the stored tail seq must be the stored one.
     */
    private void requireSameHistory(ChatSession session, long storedSeq) {
        if (storedSeq == 0) {
            return;
        }
        if (storedSeq > session.lastSeq()) {
            throw new OptimisticLockingFailureException(
                    "chat session " + session.id() + " is stale: stored seq " + storedSeq
                            + " > snapshot seq " + session.lastSeq());
        }
        var storedTailId = jdbcTemplate.queryForObject(
                "select id from chat_message where session_id = ? and seq = ?",
                String.class,
                session.id(),
                storedSeq
        );
        var snapshotTailId = session.messages().get((int) storedSeq - 1).id();
        if (!snapshotTailId.equals(storedTailId)) {
            throw new OptimisticLockingFailureException(
                    "chat session " + session.id() + " diverged at seq " + storedSeq);
        }
    }

    @Override
    public List<ChatSession> findOpen() {
        var sessions = jdbcTemplate.query("""
                        select id, user_identifier, assigned_agent_id, status, escalated, created_at, last_activity_at
                        from chat_session
                        where status <> ?
                        order by last_activity_at desc
                        """,
                SESSION_ROW,
                SessionStatus.RESOLVED.wireValue()
        );
        if (sessions.isEmpty()) {
            return List.of();
        }

        var messages = jdbcTemplate.query("""
                        select m.id, m.session_id, m.seq, m.sender, m.text_content, m.created_at
                        from chat_message m
                        join chat_session s on s.id = m.session_id
                        where s.status <> ?
                        order by m.session_id asc, m.seq asc
                        """,
                MESSAGE_ROW,
                SessionStatus.RESOLVED.wireValue()
        );
        Map<String, List<ChatMessage>> bySession = new HashMap<>();
        for (var m : messages) {
            bySession.computeIfAbsent(m.sessionId(), k -> new ArrayList<>()).add(m);
        }

        var out = new ArrayList<ChatSession>(sessions.size());
        for (var row : sessions) {
            out.add(toSession(row, bySession.getOrDefault(row.id(), List.of())));
        }
        return out;
    }

    private List<ChatMessage> listMessages(String sessionId) {
        var sql = """
                select id, session_id, seq, sender, text_content, created_at
                from chat_message
                where session_id = ?
                order by seq asc
                """;
        return jdbcTemplate.query(sql, MESSAGE_ROW, sessionId);
    }

    private static ChatSession toSession(SessionRow row, List<ChatMessage> messages) {
        return new ChatSession(
                row.id(),
                row.userIdentifier(),
                row.assignedAgentId(),
                SessionStatus.fromWire(row.status()),
                row.escalated(),
                messages,
                row.createdAt().toInstant(),
                row.lastActivityAt().toInstant()
        );
    }
}
