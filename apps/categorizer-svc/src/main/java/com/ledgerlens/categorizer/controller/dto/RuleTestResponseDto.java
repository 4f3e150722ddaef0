package com.ledgerlens.categorizer.controller.dto;

import java.util.List;

public record RuleTestResponseDto(
        String pattern,
        String patternType,
        int matchesFound,
        int totalTransactions,
        double matchRate,
        List<TransactionResponseDto> sampleMatches,
        List<RuleConflictDto> potentialConflicts
) {
    public record RuleConflictDto(String ruleId, String pattern, String type) {
    }
}
