package com.eventvalidate.supportchat.chat.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class SessionCacheScheduler {

    private static final Logger log = LoggerFactory.getLogger(SessionCacheScheduler.class);

    private final SessionStore sessionStore;
    private final Duration resolvedRetention;

    public SessionCacheScheduler(
            SessionStore sessionStore,
            @Value("${app.chat.cache.resolved-retention-minutes:30}") long resolvedRetentionMinutes
    ) {
        this.sessionStore = sessionStore;
        this.resolvedRetention = Duration.ofMinutes(Math.max(0, resolvedRetentionMinutes));
    }

    @Scheduled(fixedDelayString = "${app.chat.cache.sweep-interval-ms:60000}")
    public void evictResolvedSessions() {
        try {
            var cutoff = sessionStore.now().minus(resolvedRetention);
            var evicted = sessionStore.evictResolved(cutoff);
            if (evicted > 0) {
                log.info("chat_cache_evicted resolved={} cutoff={}", evicted, cutoff);
            }
        } catch (Exception e) {
            log.warn("chat_cache_sweep_failed", e);
        }
    }
}
