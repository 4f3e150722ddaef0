package com.ledgerlens.categorizer.controller.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RuleTestRequestDto(
        @NotBlank @Size(max = 255) String pattern,
        @NotBlank String patternType,
        @Min(1) @Max(100) Integer limit
) {
}
