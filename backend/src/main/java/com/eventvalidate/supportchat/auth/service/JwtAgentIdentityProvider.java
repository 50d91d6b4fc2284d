package com.eventvalidate.supportchat.auth.service;

import com.eventvalidate.supportchat.auth.service.jwt.JwtService;
import io.jsonwebtoken.JwtException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Resolves agents from HS256 tokens (subject = agent id, role {@code agent} or {@code admin}).
 * Without a token the client-supplied id is accepted only when
 * {@code app.chat.agent-auth.trust-client-id} is on.
 */
@Component
public class JwtAgentIdentityProvider implements AgentIdentityProvider {

    private static final Logger log = LoggerFactory.getLogger(JwtAgentIdentityProvider.class);

    private final JwtService jwtService;
    private final boolean trustClientId;

    public JwtAgentIdentityProvider(
            JwtService jwtService,
            @Value("${app.chat.agent-auth.trust-client-id:false}") boolean trustClientId
    ) {
        this.jwtService = jwtService;
        this.trustClientId = trustClientId;
    }

    @Override
    public Optional<String> resolveAgentId(String credential, String claimedAgentId) {
        if (credential != null && !credential.isBlank()) {
            try {
                var claims = jwtService.parse(credential);
                if (!claims.isAgent() || claims.agentId() == null || claims.agentId().isBlank()) {
                    return Optional.empty();
                }
                if (claimedAgentId != null && !claimedAgentId.isBlank() && !claimedAgentId.equals(claims.agentId())) {
                    log.info("agent_id_mismatch tokenAgentId={} claimedAgentId={}", claims.agentId(), claimedAgentId);
                }
                return Optional.of(claims.agentId());
            } catch (JwtException | IllegalArgumentException ex) {
                log.debug("agent_token_rejected reason={}", ex.getMessage());
                return Optional.empty();
            }
        }
        if (trustClientId && claimedAgentId != null && !claimedAgentId.isBlank()) {
            return Optional.of(claimedAgentId);
        }
        return Optional.empty();
    }
}
