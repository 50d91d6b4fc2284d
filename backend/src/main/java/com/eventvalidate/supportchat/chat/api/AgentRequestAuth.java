package com.eventvalidate.supportchat.chat.api;

import com.eventvalidate.supportchat.auth.service.AgentIdentityProvider;
import com.eventvalidate.supportchat.auth.service.jwt.JwtService;
import org.springframework.stereotype.Component;

/**
 * Resolves the caller of a REST request from the {@code Authorization} header. Agents may fall
 * back to the id in the request when client-supplied ids are trusted; bot replies always need a
 * bearer token.
 */
@Component
public class AgentRequestAuth {

    private final AgentIdentityProvider identityProvider;
    private final JwtService jwtService;

    public AgentRequestAuth(AgentIdentityProvider identityProvider, JwtService jwtService) {
        this.identityProvider = identityProvider;
        this.jwtService = jwtService;
    }

    public String requireAgentId(String authorization, String claimedAgentId) {
        var token = JwtService.extractBearerToken(authorization).orElse(null);
        return identityProvider.resolveAgentId(token, claimedAgentId)
                .orElseThrow(() -> new IllegalArgumentException("unauthorized"));
    }

    /**
     * Accepts a token with role {@code bot}, or an agent token. Invalid or expired tokens surface
     * as {@link io.jsonwebtoken.JwtException}.
     */
    public String requireBotService(String authorization) {
        var token = JwtService.extractBearerToken(authorization)
                .orElseThrow(() -> new IllegalArgumentException("missing_token"));
        var claims = jwtService.parse(token);
        if (!claims.isBot() && !claims.isAgent()) {
            throw new IllegalArgumentException("forbidden");
        }
        return claims.agentId();
    }
}
