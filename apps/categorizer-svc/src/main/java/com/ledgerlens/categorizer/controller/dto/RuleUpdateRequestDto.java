package com.ledgerlens.categorizer.controller.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

/**
 * Every field is optional; absent fields keep their stored value. An empty subcategory clears it.
 */
public record RuleUpdateRequestDto(
        @Size(min = 1, max = 255) String pattern,
        String patternType,
        @Size(min = 1, max = 100) String category,
        @Size(max = 100) String subcategory,
        @Min(0) @Max(1000) Integer priority,
        Boolean active
) {
}
