package com.ledgerlens.categorizer.controller.dto;

import com.ledgerlens.categorizer.categorization.CategorizationService.BatchCategorizationResult;

public record CategorizationRunResponseDto(
        int totalTransactions,
        int categorizedCount,
        int ruleCategorized,
        int mlCategorized,
        int failed,
        double successRate
) {
    public static CategorizationRunResponseDto from(BatchCategorizationResult result) {
        return new CategorizationRunResponseDto(
                result.totalTransactions(),
                result.categorizedCount(),
                result.ruleCategorized(),
                result.mlCategorized(),
                result.failed(),
                result.successRate()
        );
    }
}
