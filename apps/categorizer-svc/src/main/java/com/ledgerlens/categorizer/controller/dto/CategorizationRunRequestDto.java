package com.ledgerlens.categorizer.controller.dto;

import jakarta.validation.constraints.Size;
import java.util.Optional;

public record CategorizationRunRequestDto(@Size(max = 64) String batchId) {

    public Optional<String> batchIdValue() {
        return Optional.ofNullable(batchId).filter(value -> !value.isBlank());
    }
}
