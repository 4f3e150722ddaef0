package com.ledgerlens.categorizer.controller;

import com.ledgerlens.categorizer.security.CookieBearerTokenFilter;
import com.ledgerlens.categorizer.security.JwtIssuerService;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Issues tokens for local work and tests. Not registered under the {@code prod} profile.
 */
@RestController
@RequestMapping("/dev/auth")
@Profile("!prod")
public class DevAuthController {

    private static final Logger log = LoggerFactory.getLogger(DevAuthController.class);

    private final JwtIssuerService issuerService;

    public DevAuthController(JwtIssuerService issuerService) {
        this.issuerService = issuerService;
    }

    public record LoginRequest(String userId) {
    }

    public record LoginResponse(String token, UUID userId, long expiresInSeconds) {
    }

    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@RequestBody(required = false) LoginRequest body) {
        UUID userId = body != null && body.userId() != null && !body.userId().isBlank()
                ? parseUserId(body.userId())
                : UUID.randomUUID();
        long ttl = issuerService.defaultTtlSeconds();
        String token = issuerService.issue(userId, ttl);
        ResponseCookie cookie = ResponseCookie.from(CookieBearerTokenFilter.TOKEN_COOKIE, token)
                .httpOnly(true)
                .path("/")
                .sameSite("Lax")
                .maxAge(Duration.ofSeconds(ttl))
                .build();
        log.debug("Issued dev token for user {}", userId);
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookie.toString())
                .body(new LoginResponse(token, userId, ttl));
    }

    private static UUID parseUserId(String raw) {
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("userId must be a UUID");
        }
    }
}
