package com.eventvalidate.supportchat.auth.service.jwt;

public record JwtClaims(
        String agentId,
        String role,
        String displayName
) {
    public boolean isAgent() {
        return "agent".equals(role) || "admin".equals(role);
    }

    public boolean isBot() {
        return "bot".equals(role);
    }
}
