package com.ledgerlens.categorizer.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public record Transaction(
        UUID id,
        UUID userId,
        Optional<String> importBatch,
        String description,
        Optional<String> vendor,
        BigDecimal amount,
        Instant occurredAt,
        String category,
        String subcategory,
        boolean categorized,
        Double confidenceScore,
        CategorizationMethod categorizationMethod
) {
    public Transaction {
        if (description == null) {
            throw new IllegalArgumentException("description must be provided");
        }
        if (categorized != (category != null)) {
            throw new IllegalArgumentException("categorized flag must match category presence");
        }
        importBatch = importBatch == null ? Optional.empty() : importBatch;
        vendor = vendor == null ? Optional.empty() : vendor;
    }

    public static Transaction uncategorized(
            UUID id,
            UUID userId,
            String importBatch,
            String description,
            String vendor,
            BigDecimal amount,
            Instant occurredAt
    ) {
        return new Transaction(
                id,
                userId,
                Optional.ofNullable(importBatch),
                description,
                Optional.ofNullable(vendor),
                amount,
                occurredAt,
                null,
                null,
                false,
                null,
                null
        );
    }

    public Transaction withCategorization(String newCategory, String newSubcategory, double confidence, CategorizationMethod method) {
        if (newCategory == null) {
            throw new IllegalArgumentException("category must be provided");
        }
        return new Transaction(
                id,
                userId,
                importBatch,
                description,
                vendor,
                amount,
                occurredAt,
                newCategory,
                newSubcategory,
                true,
                confidence,
                method
        );
    }

    /**
     * Vendor name when present and not blank.
     */
    public Optional<String> vendorName() {
        return vendor.filter(value -> !value.isBlank());
    }
}
