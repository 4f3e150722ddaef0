package com.ledgerlens.categorizer.controller.dto;

import java.util.List;

public record RulesListResponseDto(List<RuleResponseDto> rules, String traceId) {
}
