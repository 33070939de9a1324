package com.unconference.backend.support;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.List;
import java.util.UUID;

import javax.crypto.SecretKey;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;

/**
 * Mints HS256 tokens shaped like the identity service's, signed with the test secret.
 */
public final class TestAccessTokens {

    public static final String SECRET = "unconference-test-secret-key-with-enough-bytes";

    public static final UUID FACILITATOR_ID = UUID.fromString("00000000-0000-0000-0000-000000000901");
    public static final UUID VIEWER_ID = UUID.fromString("00000000-0000-0000-0000-000000000902");
    public static final UUID ADMIN_ID = UUID.fromString("00000000-0000-0000-0000-000000000903");

    private TestAccessTokens() {
    }

    public static String facilitator() {
        return token(FACILITATOR_ID, "Fran Facilitator", List.of("FACILITATOR"), Instant.now().plus(1, ChronoUnit.HOURS));
    }

    public static String viewer() {
        return token(VIEWER_ID, "Val Viewer", List.of("VIEWER"), Instant.now().plus(1, ChronoUnit.HOURS));
    }

    public static String admin() {
        return token(ADMIN_ID, "Ada Admin", List.of("ADMIN"), Instant.now().plus(1, ChronoUnit.HOURS));
    }

    public static String token(UUID userId, String name, List<String> roles, Instant expiresAt) {
        return token(SECRET, userId, name, roles, expiresAt);
    }

    public static String token(String secret, UUID userId, String name, List<String> roles, Instant expiresAt) {
        SecretKey key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        return Jwts.builder()
                .subject(userId.toString())
                .claim("name", name)
                .claim("roles", roles)
                .issuedAt(Date.from(expiresAt.minus(2, ChronoUnit.HOURS)))
                .expiration(Date.from(expiresAt))
                .signWith(key)
                .compact();
    }
}
