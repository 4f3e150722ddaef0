package com.ledgerlens.categorizer.controller.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RuleRequestDto(
        @NotBlank @Size(max = 255) String pattern,
        @NotBlank String patternType,
        @NotBlank @Size(max = 100) String category,
        @Size(max = 100) String subcategory,
        @Min(0) @Max(1000) Integer priority,
        Boolean active
) {
}
