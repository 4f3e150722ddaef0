package com.ledgerlens.categorizer.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ledgerlens.categorizer.model.Transaction;
import java.math.BigDecimal;
import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TransactionResponseDto(
        String id,
        String importBatch,
        String description,
        String vendor,
        BigDecimal amount,
        Instant occurredAt,
        String category,
        String subcategory,
        boolean categorized,
        Double confidenceScore,
        String categorizationMethod
) {
    public static TransactionResponseDto from(Transaction transaction) {
        return new TransactionResponseDto(
                transaction.id().toString(),
                transaction.importBatch().orElse(null),
                transaction.description(),
                transaction.vendor().orElse(null),
                transaction.amount(),
                transaction.occurredAt(),
                transaction.category(),
                transaction.subcategory(),
                transaction.categorized(),
                transaction.confidenceScore(),
                transaction.categorizationMethod() == null ? null : transaction.categorizationMethod().name()
        );
    }
}
