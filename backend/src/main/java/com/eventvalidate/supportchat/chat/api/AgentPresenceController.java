package com.eventvalidate.supportchat.chat.api;

import com.eventvalidate.supportchat.chat.service.AgentPresenceService;
import com.eventvalidate.supportchat.chat.ws.ConnectionRegistry;
import com.eventvalidate.supportchat.common.api.ApiResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;

@RestController
@RequestMapping("/api/v1/support/agents")
public class AgentPresenceController {

    private static final Logger log = LoggerFactory.getLogger(AgentPresenceController.class);

    private final AgentPresenceService agentPresenceService;
    private final ConnectionRegistry registry;
    private final AgentRequestAuth agentRequestAuth;

    public AgentPresenceController(
            AgentPresenceService agentPresenceService,
            ConnectionRegistry registry,
            AgentRequestAuth agentRequestAuth
    ) {
        this.agentPresenceService = agentPresenceService;
        this.registry = registry;
        this.agentRequestAuth = agentRequestAuth;
    }

    @PostMapping("/heartbeat")
    public ApiResponse<AgentStatusResponse> heartbeat(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @RequestBody(required = false) AgentHeartbeatRequest req
    ) {
        var agentId = agentRequestAuth.requireAgentId(authorization, req == null ? null : req.admin_id());
        agentPresenceService.markSeen(agentId);
        log.debug("agent_heartbeat agentId={}", agentId);
        return ApiResponse.ok(currentStatus());
    }

    @GetMapping("/status")
    public ApiResponse<AgentStatusResponse> status() {
        return ApiResponse.ok(currentStatus());
    }

    private AgentStatusResponse currentStatus() {
        var online = new ArrayList<>(agentPresenceService.onlineAgents());
        return new AgentStatusResponse(
                !online.isEmpty(),
                online,
                registry.allAgentConnections().size(),
                agentPresenceService.onlineWindowSeconds()
        );
    }
}
