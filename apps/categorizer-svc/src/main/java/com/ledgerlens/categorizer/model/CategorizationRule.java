package com.ledgerlens.categorizer.model;

import java.time.Instant;
import java.util.UUID;

public record CategorizationRule(
        UUID id,
        UUID userId,
        String pattern,
        PatternType patternType,
        String category,
        String subcategory,
        int priority,
        boolean active,
        Instant createdAt,
        Instant updatedAt
) {
    public static final int DEFAULT_PRIORITY = 1;
    public static final int USER_CORRECTION_PRIORITY = 10;
    // Width of the pattern column; derived patterns are cut to fit
    public static final int MAX_STORED_PATTERN_LENGTH = 500;

    public CategorizationRule withTarget(String newCategory, String newSubcategory, int newPriority, Instant now) {
        return new CategorizationRule(id, userId, pattern, patternType, newCategory, newSubcategory, newPriority, active, createdAt, now);
    }

    public CategorizationRule withDefinition(
            String newPattern,
            PatternType newPatternType,
            String newCategory,
            String newSubcategory,
            int newPriority,
            boolean newActive,
            Instant now
    ) {
        return new CategorizationRule(id, userId, newPattern, newPatternType, newCategory, newSubcategory, newPriority, newActive, createdAt, now);
    }
}
