package com.ledgerlens.categorizer.security;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.ledgerlens.categorizer.config.CategorizerProperties;
import com.ledgerlens.categorizer.config.SecurityConfig;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;

class JwtIssuerServiceTest {

    private static final String SECRET = "12345678901234567890123456789012";

    private static CategorizerProperties properties(String secret) {
        return new CategorizerProperties(new CategorizerProperties.Security(secret, 120L), null);
    }

    @Test
    void issuedTokenIsAcceptedByResourceServerDecoder() {
        CategorizerProperties props = properties(SECRET);
        UUID userId = UUID.fromString("0f08d2b9-28b3-4b28-bd33-41a36161e9ab");
        String token = new JwtIssuerService(props).issue(userId);

        JwtDecoder decoder = new SecurityConfig().jwtDecoder(props);
        Jwt jwt = decoder.decode(token);

        assertEquals(userId.toString(), jwt.getSubject());
        assertEquals(JwtIssuerService.ISSUER, jwt.getClaimAsString("iss"));
    }

    @Test
    void expiredTokenIsRejected() {
        CategorizerProperties props = properties(SECRET);
        Clock past = Clock.fixed(Instant.now().minusSeconds(7200), ZoneOffset.UTC);
        String token = new JwtIssuerService(props, past).issue(UUID.randomUUID(), 60);

        JwtDecoder decoder = new SecurityConfig().jwtDecoder(props);

        assertThrows(JwtException.class, () -> decoder.decode(token));
    }

    @Test
    void tokenSignedWithAnotherSecretIsRejected() {
        String token = new JwtIssuerService(properties("abcdefghijklmnopqrstuvwxyz0123456789")).issue(UUID.randomUUID());

        JwtDecoder decoder = new SecurityConfig().jwtDecoder(properties(SECRET));

        assertThrows(JwtException.class, () -> decoder.decode(token));
    }

    @Test
    void tooShortSecretIsRejected() {
        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> new JwtIssuerService(properties("shortsecret")));
        assertTrue(ex.getMessage().contains("32"));
    }

    @Test
    void ttlMustBePositive() {
        JwtIssuerService issuer = new JwtIssuerService(properties(SECRET));
        assertThrows(IllegalArgumentException.class, () -> issuer.issue(UUID.randomUUID(), 0));
    }
}
