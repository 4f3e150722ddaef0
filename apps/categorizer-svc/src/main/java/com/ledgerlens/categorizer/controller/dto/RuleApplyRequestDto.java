package com.ledgerlens.categorizer.controller.dto;

public record RuleApplyRequestDto(Boolean forceRecategorize) {

    public boolean forceRecategorizeFlag() {
        return Boolean.TRUE.equals(forceRecategorize);
    }
}
