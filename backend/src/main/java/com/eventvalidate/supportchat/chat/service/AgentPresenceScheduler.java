package com.eventvalidate.supportchat.chat.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class AgentPresenceScheduler {

    private static final Logger log = LoggerFactory.getLogger(AgentPresenceScheduler.class);

    private final AgentPresenceService agentPresenceService;

    public AgentPresenceScheduler(AgentPresenceService agentPresenceService) {
        this.agentPresenceService = agentPresenceService;
    }

    @Scheduled(fixedDelayString = "${app.chat.presence.sweep-interval-ms:30000}")
    public void sweepStaleAgents() {
        try {
            var removed = agentPresenceService.sweepStale();
            if (removed > 0) {
                log.debug("agent_presence_swept removed={}", removed);
            }
        } catch (Exception e) {
            log.warn("agent_presence_sweep_failed", e);
        }
    }
}
