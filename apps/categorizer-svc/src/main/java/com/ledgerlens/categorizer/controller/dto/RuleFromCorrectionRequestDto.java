package com.ledgerlens.categorizer.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.UUID;

public record RuleFromCorrectionRequestDto(
        @NotNull UUID transactionId,
        @NotBlank @Size(max = 100) String category,
        @Size(max = 100) String subcategory
) {
}
