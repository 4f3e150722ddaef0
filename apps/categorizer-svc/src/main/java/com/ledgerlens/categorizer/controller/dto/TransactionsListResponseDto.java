package com.ledgerlens.categorizer.controller.dto;

import java.util.List;

public record TransactionsListResponseDto(List<TransactionResponseDto> transactions, int total, String traceId) {
}
