package com.ledgerlens.categorizer.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CategoryUpdateRequestDto(
        @NotBlank @Size(max = 100) String category,
        @Size(max = 100) String subcategory
) {
}
