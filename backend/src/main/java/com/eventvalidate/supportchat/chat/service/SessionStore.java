package com.eventvalidate.supportchat.chat.service;

import com.eventvalidate.supportchat.chat.domain.ChatSession;
import com.eventvalidate.supportchat.chat.domain.MessageSender;
import com.eventvalidate.supportchat.chat.domain.SessionStatus;
import com.eventvalidate.supportchat.chat.error.SessionNotFoundException;
import com.eventvalidate.supportchat.chat.error.StorePersistenceException;
import com.eventvalidate.supportchat.chat.repo.ChatSessionRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Authoritative access to chat sessions: a write-through cache in front of
 * {@link ChatSessionRepository}.
 *
 * <p>Every write goes to the durable store first and reaches the cache only after that succeeds.
 * A write that times out keeps running in the background; no further read or write for that
 * session reaches the store until it has settled. All writes for one session id are serialized
 * through {@link SessionLocks}; callers that need a
 * read-check-write sequence (or delivery ordered with persistence) wrap it in
 * {@link #withSessionLock}.
 */
@Service
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    private final ChatSessionRepository repository;
    private final SessionLocks locks;
    private final Executor storeExecutor;
    private final Duration writeTimeout;
    private final Clock clock;

    private final Map<String, ChatSession> cache = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Void>> inFlight = new ConcurrentHashMap<>();

    private final Timer writeTimer;
    private final Counter writeFailures;

    public SessionStore(
            ChatSessionRepository repository,
            SessionLocks locks,
            @Qualifier("chatStoreExecutor") Executor storeExecutor,
            @Value("${app.chat.store.write-timeout-ms:5000}") long writeTimeoutMs,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.repository = repository;
        this.locks = locks;
        this.storeExecutor = storeExecutor;
        this.writeTimeout = Duration.ofMillis(Math.max(1, writeTimeoutMs));
        this.clock = clock;
        this.writeTimer = Timer.builder("chat.store.write")
                .description("Durable chat session writes")
                .register(meterRegistry);
        this.writeFailures = Counter.builder("chat.store.write.failures")
                .description("Durable chat session writes that failed or timed out")
                .register(meterRegistry);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void warmUp() {
        try {
            var open = repository.findOpen();
            for (var s : open) {
                cache.putIfAbsent(s.id(), s);
            }
            log.info("chat_cache_warmed sessions={}", open.size());
        } catch (RuntimeException ex) {
            log.warn("chat_cache_warm_failed", ex);
        }
    }

    public <T> T withSessionLock(String sessionId, Supplier<T> action) {
        return locks.withLock(sessionId, action);
    }

    public Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }

    public Optional<ChatSession> loadSession(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        var cached = cache.get(id);
        if (cached != null) {
            return Optional.of(cached);
        }
        return locks.withLock(id, () -> {
            var again = cache.get(id);
            if (again != null) {
                return Optional.of(again);
            }
            var loaded = readDurable(id);
            loaded.ifPresent(s -> cache.put(id, s));
            return loaded;
        });
    }

    /**
     * Re-reads the durable record, bypassing the cache, and replaces the cached copy with it.
     */
    public Optional<ChatSession> reloadCanonical(String id) {
        return locks.withLock(id, () -> {
            var loaded = readDurable(id);
            if (loaded.isPresent()) {
                var previous = cache.put(id, loaded.get());
                if (previous != null && previous.lastSeq() != loaded.get().lastSeq()) {
                    log.info("chat_session_reconciled sessionId={} cachedSeq={} durableSeq={}",
                            id, previous.lastSeq(), loaded.get().lastSeq());
                }
            } else {
                cache.remove(id);
            }
            return loaded;
        });
    }

    public ChatSession loadOrCreate(String id, String userIdentifier) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("missing_session_id");
        }
        return locks.withLock(id, () -> {
            var existing = loadSession(id);
            if (existing.isPresent()) {
                return existing.get();
            }
            var created = ChatSession.open(id, userIdentifier, now());
            persist(created);
            log.info("chat_session_created sessionId={}", id);
            return created;
        });
    }

    public ChatSession appendMessage(String id, MessageSender sender, String text) {
        return update(id, (s, now) -> s.withMessage(sender, text, now));
    }

    public ChatSession updateStatus(String id, SessionStatus status, String assignedAgentId) {
        return update(id, (s, now) -> s.transitionTo(status, assignedAgentId, now));
    }

    /**
     * Serialized read-modify-write of an existing session. The mutation runs against the current
     * cached (or durable) state; an unchanged result is not written.
     */
    public ChatSession update(String id, SessionMutation mutation) {
        return locks.withLock(id, () -> {
            var current = loadSession(id).orElseThrow(() -> new SessionNotFoundException(id));
            var next = mutation.apply(current, now());
            if (next == current) {
                return current;
            }
            persist(next);
            return next;
        });
    }

    public List<ChatSession> listActiveSessions() {
        return cache.values().stream()
                .filter(s -> s.status().isOpen())
                .sorted(Comparator.comparing(ChatSession::lastActivityAt).reversed()
                        .thenComparing(ChatSession::id))
                .toList();
    }

    /**
     * Drops resolved sessions idle since before {@code cutoff} from the cache. They stay readable
     * from the durable store.
     */
    public int evictResolved(Instant cutoff) {
        int evicted = 0;
        for (var entry : cache.entrySet()) {
            var s = entry.getValue();
            if (s.isResolved() && s.lastActivityAt().isBefore(cutoff)) {
                if (cache.remove(entry.getKey(), s)) {
                    evicted++;
                }
            }
        }
        return evicted;
    }

    int cachedCount() {
        return cache.size();
    }

    private Optional<ChatSession> readDurable(String id) {
        awaitInFlightWrite(id);
        try {
            return repository.loadById(id);
        } catch (RuntimeException ex) {
            log.warn("chat_store_read_failed sessionId={}", id, ex);
            throw new StorePersistenceException("store read failed: " + ex.getMessage(), ex);
        }
    }

    private void persist(ChatSession session) {
        var id = session.id();
        awaitInFlightWrite(id);

        var start = System.nanoTime();
        final CompletableFuture<Void> future;
        try {
            future = CompletableFuture.runAsync(() -> repository.save(session), storeExecutor);
        } catch (RejectedExecutionException ex) {
            throw failWrite(id, "store executor rejected write", ex);
        }
        try {
            future.get(writeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            // JDBC work cannot be cancelled; keep the write so later writes for this id wait for it
            inFlight.put(id, future);
            future.whenComplete((v, err) -> log.info("chat_store_write_settled sessionId={} failed={}",
                    id, err != null));
            throw failWrite(id, "store write timed out after " + writeTimeout.toMillis() + "ms", ex);
        } catch (ExecutionException ex) {
            var cause = ex.getCause() == null ? ex : ex.getCause();
            throw failWrite(id, "store write failed: " + cause.getMessage(), cause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            inFlight.put(id, future);
            throw failWrite(id, "store write interrupted", ex);
        } finally {
            writeTimer.record(System.nanoTime() - start, TimeUnit.NANOSECONDS);
        }
        cache.put(id, session);
    }

    /**
     * Blocks until an earlier timed-out write for {@code id} has settled. Fails when it is still
     * running after another full write timeout.
     */
    private void awaitInFlightWrite(String id) {
        var pending = inFlight.get(id);
        if (pending == null) {
            return;
        }
        try {
            pending.get(writeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            writeFailures.increment();
            log.warn("chat_store_write_in_doubt sessionId={}", id);
            throw new StorePersistenceException("previous store write still in flight", ex);
        } catch (ExecutionException ex) {
            log.debug("chat_store_in_doubt_write_failed sessionId={} reason={}", id, String.valueOf(ex.getCause()));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new StorePersistenceException("interrupted waiting for previous store write", ex);
        }
        inFlight.remove(id, pending);
        cache.remove(id);
    }

    private StorePersistenceException failWrite(String sessionId, String message, Throwable cause) {
        writeFailures.increment();
        // the durable outcome is unknown; force the next read to go to the store
        cache.remove(sessionId);
        log.warn("chat_store_write_failed sessionId={} reason={}", sessionId, message, cause);
        return new StorePersistenceException(message, cause);
    }
}
