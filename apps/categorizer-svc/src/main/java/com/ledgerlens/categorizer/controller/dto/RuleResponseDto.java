package com.ledgerlens.categorizer.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ledgerlens.categorizer.model.CategorizationRule;
import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RuleResponseDto(
        String id,
        String pattern,
        String patternType,
        String category,
        String subcategory,
        int priority,
        boolean active,
        Instant createdAt,
        Instant updatedAt
) {
    public static RuleResponseDto from(CategorizationRule rule) {
        return new RuleResponseDto(
                rule.id().toString(),
                rule.pattern(),
                rule.patternType().value(),
                rule.category(),
                rule.subcategory(),
                rule.priority(),
                rule.active(),
                rule.createdAt(),
                rule.updatedAt()
        );
    }
}
