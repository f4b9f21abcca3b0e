package com.flagship.storefront_payments.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

/**
 * Verifies bearer tokens issued by the storefront's auth provider.
 *
 * Tokens are HS256-signed with the provider's shared secret; {@code sub} is the user's
 * UUID and the {@code email} claim carries the address the gateway receipt goes to.
 * Issuing tokens is the provider's job; {@link #createToken} exists for local tooling and tests.
 */
@Component
@Slf4j
public class JwtTokenProvider {

    static final String EMAIL_CLAIM = "email";

    private final SecretKey key;
    private final long expirationMs;

    public JwtTokenProvider(
            @Value("${auth.jwt.secret:local-development-secret-change-me-0123456789}") String secret,
            @Value("${auth.jwt.expiration-ms:3600000}") long expirationMs) {
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
        this.expirationMs = expirationMs;
    }

    public String createToken(UUID userId, String email) {
        Date now = new Date();
        return Jwts.builder()
                .subject(userId.toString())
                .claim(EMAIL_CLAIM, email)
                .issuedAt(now)
                .expiration(new Date(now.getTime() + expirationMs))
                .signWith(key)
                .compact();
    }

    /**
     * @return the caller, or empty if the token is malformed, expired or badly signed,
     *         or its subject is missing or not a UUID
     */
    public Optional<CallerIdentity> resolve(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            String subject = claims.getSubject();
            if (subject == null || subject.isBlank()) {
                log.debug("Rejected bearer token without a subject");
                return Optional.empty();
            }
            UUID userId = UUID.fromString(subject);
            return Optional.of(new CallerIdentity(userId, claims.get(EMAIL_CLAIM, String.class)));

        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
