package com.ledgerlens.categorizer.controller.dto;

public record CategoryUpdateResponseDto(
        String transactionId,
        boolean updated,
        int autoCategorizedCount,
        boolean newRuleCreated,
        String previousCategory,
        String traceId
) {
}
