package com.ledgerlens.categorizer.security;

import java.util.Optional;
import java.util.UUID;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

/**
 * Resolves the calling user from the JWT subject. Subjects that are not UUIDs yield no user.
 */
@Component
public class AuthenticatedUserProvider {

    public UUID requireCurrentUserId() {
        return currentUserId().orElseThrow(() -> new IllegalStateException("user context missing"));
    }

    public Optional<UUID> currentUserId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (!(authentication instanceof JwtAuthenticationToken jwtAuthentication)) {
            return Optional.empty();
        }
        Optional<UUID> userId = parseUserId(jwtAuthentication.getName());
        userId.ifPresent(RequestContextHolder::setUserId);
        return userId;
    }

    static Optional<UUID> parseUserId(String subject) {
        if (subject == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(subject));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
