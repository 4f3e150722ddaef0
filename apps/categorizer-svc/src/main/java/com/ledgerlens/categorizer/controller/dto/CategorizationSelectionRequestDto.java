package com.ledgerlens.categorizer.controller.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.UUID;

public record CategorizationSelectionRequestDto(
        @NotEmpty @Size(max = 1000) List<@NotNull UUID> transactionIds,
        Boolean useMlFallback
) {
    public boolean useMlFallbackFlag() {
        return useMlFallback == null || useMlFallback;
    }
}
