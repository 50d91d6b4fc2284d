package com.eventvalidate.supportchat.auth.service.jwt;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

@Service
public class JwtService {

    private final SecretKey key;

    public JwtService(@Value("${app.jwt.secret:dev-secret-change-me-please-32bytes-min}") String secret) {
        var bytes = secret.getBytes(StandardCharsets.UTF_8);
        this.key = Keys.hmacShaKeyFor(bytes);
    }

    /**
     * Tokens are normally minted by the platform's login service; this is used by tooling and tests.
     */
    public String issueAgentToken(String agentId, String role, String displayName, Duration ttl) {
        var now = Instant.now();
        return Jwts.builder()
                .setSubject(agentId)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plus(ttl)))
                .claim("role", role)
                .claim("name", displayName == null ? "" : displayName)
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * Credential for the automated responder posting bot replies.
     */
    public String issueServiceToken(String serviceName, Duration ttl) {
        return issueAgentToken(serviceName, "bot", serviceName, ttl);
    }

    public JwtClaims parse(String token) {
        Claims claims = Jwts.parserBuilder()
                .setSigningKey(key)
                .build()
                .parseClaimsJws(token)
                .getBody();

        var agentId = claims.getSubject();
        var role = String.valueOf(claims.get("role"));
        var name = String.valueOf(claims.getOrDefault("name", ""));
        return new JwtClaims(agentId, role, name);
    }

    public static Optional<String> extractBearerToken(String authorization) {
        if (authorization == null || authorization.isBlank()) return Optional.empty();
        var prefix = "Bearer ";
        if (!authorization.startsWith(prefix)) return Optional.empty();
        var token = authorization.substring(prefix.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
