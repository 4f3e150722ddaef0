package com.ledgerlens.categorizer.controller;

import com.ledgerlens.categorizer.categorization.CategorizationService;
import com.ledgerlens.categorizer.controller.dto.CategoriesResponseDto;
import com.ledgerlens.categorizer.controller.dto.CategorizationPerformanceResponseDto;
import com.ledgerlens.categorizer.controller.dto.CategorizationRunRequestDto;
import com.ledgerlens.categorizer.controller.dto.CategorizationRunResponseDto;
import com.ledgerlens.categorizer.controller.dto.CategorizationSelectionRequestDto;
import com.ledgerlens.categorizer.security.AuthenticatedUserProvider;
import jakarta.validation.Valid;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class CategorizationController {

    private final CategorizationService categorizationService;
    private final AuthenticatedUserProvider authenticatedUserProvider;

    public CategorizationController(
            CategorizationService categorizationService,
            AuthenticatedUserProvider authenticatedUserProvider
    ) {
        this.categorizationService = categorizationService;
        this.authenticatedUserProvider = authenticatedUserProvider;
    }

    @PostMapping("/categorization/run")
    public ResponseEntity<CategorizationRunResponseDto> run(
            @RequestBody(required = false) @Valid CategorizationRunRequestDto request
    ) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        Optional<String> batchId = request != null ? request.batchIdValue() : Optional.empty();
        var result = categorizationService.categorizeUserTransactions(userId, batchId);
        return ResponseEntity.ok(CategorizationRunResponseDto.from(result));
    }

    @PostMapping("/categorization/run-selected")
    public ResponseEntity<CategorizationRunResponseDto> runSelected(
            @RequestBody @Valid CategorizationSelectionRequestDto request
    ) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        var result = categorizationService.categorizeTransactionsByIds(userId, request.transactionIds(), request.useMlFallbackFlag());
        return ResponseEntity.ok(CategorizationRunResponseDto.from(result));
    }

    @GetMapping("/categorization/performance")
    public ResponseEntity<CategorizationPerformanceResponseDto> performance(
            @RequestParam(value = "from", required = false) Instant from,
            @RequestParam(value = "to", required = false) Instant to
    ) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        var performance = categorizationService.getCategorizationPerformance(userId, Optional.ofNullable(from), Optional.ofNullable(to));
        return ResponseEntity.ok(CategorizationPerformanceResponseDto.from(performance, TransactionsController.currentTraceId()));
    }

    @GetMapping("/categories")
    public ResponseEntity<CategoriesResponseDto> categories() {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        return ResponseEntity.ok(new CategoriesResponseDto(categorizationService.getAvailableCategories(userId)));
    }
}
