package com.ledgerlens.categorizer.controller.dto;

import java.util.UUID;

public record RuleValidationRequestDto(
        String pattern,
        String patternType,
        String category,
        String subcategory,
        UUID excludeRuleId
) {
}
