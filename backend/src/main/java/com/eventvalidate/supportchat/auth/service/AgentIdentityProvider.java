package com.eventvalidate.supportchat.auth.service;

import java.util.Optional;

/**
 * Supplies the verified agent id behind an admin connection or request. The id is treated as an
 * opaque string by the broker.
 */
public interface AgentIdentityProvider {

    /**
     * @param credential     credential presented by the client (bearer token), may be {@code null}
     * @param claimedAgentId agent id the client says it is, may be {@code null}
     * @return the agent id to act as, or empty when the caller is not an agent
     */
    Optional<String> resolveAgentId(String credential, String claimedAgentId);
}
