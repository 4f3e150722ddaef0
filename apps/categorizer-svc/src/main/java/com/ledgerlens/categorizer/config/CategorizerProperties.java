package com.ledgerlens.categorizer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "categorizer")
public record CategorizerProperties(
        Security security,
        Categorization categorization
) {

    @ConstructorBinding
    public CategorizerProperties {
        if (security == null) {
            throw new IllegalArgumentException("security configuration must be provided");
        }
        // categorization may be omitted; defaults apply via accessor
    }

    public Categorization categorization() {
        return categorization != null ? categorization : new Categorization(null, null, null);
    }

    public record Security(String jwtSecret, Long tokenTtlSeconds) {
        public Security {
            if (jwtSecret == null || jwtSecret.isBlank()) {
                throw new IllegalArgumentException("jwtSecret must be provided");
            }
            if (tokenTtlSeconds != null && tokenTtlSeconds <= 0) {
                throw new IllegalArgumentException("tokenTtlSeconds must be positive");
            }
        }

        public long tokenTtlSecondsOrDefault() {
            return tokenTtlSeconds != null ? tokenTtlSeconds : 3600L;
        }
    }

    public record Categorization(Boolean mlFallbackEnabled, Double mlMinConfidence, Double suggestionMinConfidence) {
        public Categorization {
            if (mlMinConfidence != null && (mlMinConfidence < 0 || mlMinConfidence > 1)) {
                throw new IllegalArgumentException("mlMinConfidence must be within [0, 1]");
            }
            if (suggestionMinConfidence != null && (suggestionMinConfidence < 0 || suggestionMinConfidence > 1)) {
                throw new IllegalArgumentException("suggestionMinConfidence must be within [0, 1]");
            }
        }

        public boolean mlFallbackEnabledFlag() {
            return mlFallbackEnabled == null || mlFallbackEnabled;
        }

        public double mlMinConfidenceOrDefault() {
            return mlMinConfidence != null ? mlMinConfidence : 0.6d;
        }

        public double suggestionMinConfidenceOrDefault() {
            return suggestionMinConfidence != null ? suggestionMinConfidence : 0.3d;
        }
    }
}
