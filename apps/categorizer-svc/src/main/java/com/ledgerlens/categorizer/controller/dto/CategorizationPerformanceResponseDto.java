package com.ledgerlens.categorizer.controller.dto;

import com.ledgerlens.categorizer.categorization.CategorizationService.CategorizationPerformance;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

public record CategorizationPerformanceResponseDto(
        int totalTransactions,
        int categorizedCount,
        int uncategorizedCount,
        double categorizationRate,
        double averageConfidence,
        Map<String, Integer> methods,
        ConfidenceDistributionDto confidenceDistribution,
        Map<String, CategoryStatsDto> categories,
        String traceId
) {
    public record ConfidenceDistributionDto(int high, int medium, int low) {
    }

    public record CategoryStatsDto(int count, BigDecimal totalAmount, double averageConfidence) {
    }

    public static CategorizationPerformanceResponseDto from(CategorizationPerformance performance, String traceId) {
        Map<String, CategoryStatsDto> categories = new LinkedHashMap<>();
        performance.categories().forEach((category, stats) ->
                categories.put(category, new CategoryStatsDto(stats.count(), stats.totalAmount(), stats.averageConfidence())));
        var distribution = performance.confidenceDistribution();
        return new CategorizationPerformanceResponseDto(
                performance.totalTransactions(),
                performance.categorizedCount(),
                performance.uncategorizedCount(),
                performance.categorizationRate(),
                performance.averageConfidence(),
                performance.methods(),
                new ConfidenceDistributionDto(distribution.high(), distribution.medium(), distribution.low()),
                categories,
                traceId
        );
    }
}
