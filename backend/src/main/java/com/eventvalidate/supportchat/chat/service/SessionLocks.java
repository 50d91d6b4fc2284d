package com.eventvalidate.supportchat.chat.service;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Reentrant locks keyed by session id. Each id gets its own lock, so a stalled session never
 * holds up another one. A lock is dropped once no thread holds or waits for it.
 */
@Component
public class SessionLocks {

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        int users;
    }

    private final Map<String, Entry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String sessionId, Supplier<T> action) {
        var key = sessionId == null ? "" : sessionId;
        var entry = acquire(key);
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            release(key);
        }
    }

    int liveLockCount() {
        return locks.size();
    }

    private Entry acquire(String key) {
        return locks.compute(key, (k, e) -> {
            var entry = e == null ? new Entry() : e;
            entry.users++;
            return entry;
        });
    }

    private void release(String key) {
        locks.computeIfPresent(key, (k, e) -> --e.users == 0 ? null : e);
    }
}
