package com.flagship.personal_ledger.security;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JwtOwnerTokenVerifierTest {

    private static final String SECRET = "unit-test-secret-for-owner-tokens-0123456789";

    private final JwtOwnerTokenVerifier verifier = new JwtOwnerTokenVerifier(SECRET);

    @Test
    @DisplayName("Signed token yields the subject as owner id")
    void acceptsSignedToken() {
        UUID ownerId = UUID.randomUUID();

        Optional<UUID> verified = verifier.verify(token(SECRET, ownerId.toString(), 60_000));

        assertEquals(Optional.of(ownerId), verified);
    }

    @Test
    @DisplayName("Token signed with another key is rejected")
    void rejectsForeignSignature() {
        String forged = token("another-secret-that-is-long-enough-0123456789", UUID.randomUUID().toString(), 60_000);

        assertTrue(verifier.verify(forged).isEmpty());
    }

    @Test
    @DisplayName("Expired token is rejected")
    void rejectsExpiredToken() {
        assertTrue(verifier.verify(token(SECRET, UUID.randomUUID().toString(), -60_000)).isEmpty());
    }

    @Test
    @DisplayName("Subject that is not a UUID is rejected")
    void rejectsNonUuidSubject() {
        assertTrue(verifier.verify(token(SECRET, "alice", 60_000)).isEmpty());
        assertTrue(verifier.verify("not-a-jwt").isEmpty());
    }

    @Test
    @DisplayName("Short secret fails at startup")
    void rejectsShortSecret() {
        assertThrows(IllegalStateException.class, () -> new JwtOwnerTokenVerifier("too-short"));
    }

    private static String token(String secret, String subject, long ttlMillis) {
        return Jwts.builder()
            .setSubject(subject)
            .setExpiration(new Date(System.currentTimeMillis() + ttlMillis))
            .signWith(Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8)), SignatureAlgorithm.HS256)
            .compact();
    }
}
