package com.ledgerlens.categorizer.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record TransactionImportRequestDto(
        @NotEmpty @Size(max = 1000) List<@Valid RowDto> transactions
) {
    public record RowDto(
            @NotBlank @Size(max = 500) String description,
            @Size(max = 200) String vendor,
            @NotNull @Digits(integer = 10, fraction = 2) BigDecimal amount,
            Instant occurredAt
    ) {
    }
}
