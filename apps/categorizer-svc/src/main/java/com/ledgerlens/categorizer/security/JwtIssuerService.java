package com.ledgerlens.categorizer.security;

import com.ledgerlens.categorizer.config.CategorizerProperties;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;
import javax.crypto.SecretKey;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Signs HS256 access tokens with the same shared secret the resource server verifies against.
 */
@Service
public class JwtIssuerService {

    public static final String ISSUER = "ledgerlens-categorizer";
    static final int MIN_SECRET_BYTES = 32;

    private final SecretKey key;
    private final long defaultTtlSeconds;
    private final Clock clock;

    @Autowired
    public JwtIssuerService(CategorizerProperties properties) {
        this(properties, Clock.systemUTC());
    }

    JwtIssuerService(CategorizerProperties properties, Clock clock) {
        this.key = signingKey(properties.security().jwtSecret());
        this.defaultTtlSeconds = properties.security().tokenTtlSecondsOrDefault();
        this.clock = clock;
    }

    public static SecretKey signingKey(String secret) {
        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("categorizer.security.jwt-secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        return Keys.hmacShaKeyFor(bytes);
    }

    public long defaultTtlSeconds() {
        return defaultTtlSeconds;
    }

    public String issue(UUID userId) {
        return issue(userId, defaultTtlSeconds);
    }

    public String issue(UUID userId, long ttlSeconds) {
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be positive");
        }
        Instant now = clock.instant();
        return Jwts.builder()
                .setSubject(userId.toString())
                .setIssuer(ISSUER)
                .claim("scope", "categorizer")
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plusSeconds(ttlSeconds)))
                .signWith(key)
                .compact();
    }
}
