package com.ledgerlens.categorizer.controller.dto;

public record SingleCategorizationResponseDto(boolean matched, TransactionResponseDto transaction) {
}
