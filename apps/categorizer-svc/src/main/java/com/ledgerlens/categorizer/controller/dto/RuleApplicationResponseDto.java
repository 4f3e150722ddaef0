package com.ledgerlens.categorizer.controller.dto;

public record RuleApplicationResponseDto(String ruleId, String pattern, int categorizedCount, int totalProcessed) {
}
