package com.ledgerlens.categorizer.controller.dto;

public record TransactionImportResponseDto(
        String batchId,
        int importedCount,
        CategorizationRunResponseDto categorization,
        String traceId
) {
}
