package com.ledgerlens.categorizer.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CategorizerPropertiesTest {

    private static final String SECRET = "12345678901234567890123456789012";

    @Test
    void categorizationDefaultsApplyWhenSectionMissing() {
        CategorizerProperties props = new CategorizerProperties(new CategorizerProperties.Security(SECRET, null), null);

        assertTrue(props.categorization().mlFallbackEnabledFlag());
        assertEquals(0.6, props.categorization().mlMinConfidenceOrDefault());
        assertEquals(0.3, props.categorization().suggestionMinConfidenceOrDefault());
        assertEquals(3600L, props.security().tokenTtlSecondsOrDefault());
    }

    @Test
    void securitySectionIsRequired() {
        assertThrows(IllegalArgumentException.class, () -> new CategorizerProperties(null, null));
        assertThrows(IllegalArgumentException.class, () -> new CategorizerProperties.Security(" ", null));
        assertThrows(IllegalArgumentException.class, () -> new CategorizerProperties.Security(SECRET, 0L));
    }

    @Test
    void confidenceThresholdsMustBeProbabilities() {
        assertThrows(IllegalArgumentException.class, () -> new CategorizerProperties.Categorization(true, 1.5, null));
        assertThrows(IllegalArgumentException.class, () -> new CategorizerProperties.Categorization(true, null, -0.1));
    }
}
