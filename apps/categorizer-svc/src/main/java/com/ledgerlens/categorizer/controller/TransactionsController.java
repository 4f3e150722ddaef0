package com.ledgerlens.categorizer.controller;

import com.ledgerlens.categorizer.categorization.CategorizationService;
import com.ledgerlens.categorizer.categorization.CategorizationService.CategorySuggestion;
import com.ledgerlens.categorizer.controller.dto.CategorizationRunResponseDto;
import com.ledgerlens.categorizer.controller.dto.CategorySuggestionsResponseDto;
import com.ledgerlens.categorizer.controller.dto.CategorySuggestionsResponseDto.SuggestionDto;
import com.ledgerlens.categorizer.controller.dto.CategoryUpdateRequestDto;
import com.ledgerlens.categorizer.controller.dto.CategoryUpdateResponseDto;
import com.ledgerlens.categorizer.controller.dto.SingleCategorizationResponseDto;
import com.ledgerlens.categorizer.controller.dto.TransactionImportRequestDto;
import com.ledgerlens.categorizer.controller.dto.TransactionImportResponseDto;
import com.ledgerlens.categorizer.controller.dto.TransactionResponseDto;
import com.ledgerlens.categorizer.controller.dto.TransactionsListResponseDto;
import com.ledgerlens.categorizer.model.Transaction;
import com.ledgerlens.categorizer.security.AuthenticatedUserProvider;
import com.ledgerlens.categorizer.security.RequestContextHolder;
import com.ledgerlens.categorizer.service.TransactionImportService;
import com.ledgerlens.categorizer.service.TransactionImportService.ImportRow;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/transactions")
public class TransactionsController {

    private final TransactionImportService transactionImportService;
    private final CategorizationService categorizationService;
    private final AuthenticatedUserProvider authenticatedUserProvider;

    public TransactionsController(
            TransactionImportService transactionImportService,
            CategorizationService categorizationService,
            AuthenticatedUserProvider authenticatedUserProvider
    ) {
        this.transactionImportService = transactionImportService;
        this.categorizationService = categorizationService;
        this.authenticatedUserProvider = authenticatedUserProvider;
    }

    @PostMapping("/import")
    public ResponseEntity<TransactionImportResponseDto> importTransactions(
            @RequestBody @Valid TransactionImportRequestDto request
    ) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        List<ImportRow> rows = request.transactions().stream()
                .map(row -> new ImportRow(row.description(), row.vendor(), row.amount(), row.occurredAt()))
                .toList();
        var result = transactionImportService.importTransactions(userId, rows);
        return ResponseEntity.status(HttpStatus.CREATED).body(new TransactionImportResponseDto(
                result.batchId(),
                result.importedCount(),
                CategorizationRunResponseDto.from(result.categorization()),
                currentTraceId()
        ));
    }

    @GetMapping
    public ResponseEntity<TransactionsListResponseDto> listTransactions(
            @RequestParam(value = "uncategorized", required = false, defaultValue = "false") boolean uncategorizedOnly
    ) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        List<TransactionResponseDto> transactions = transactionImportService.listTransactions(userId, uncategorizedOnly).stream()
                .map(TransactionResponseDto::from)
                .toList();
        return ResponseEntity.ok(new TransactionsListResponseDto(transactions, transactions.size(), currentTraceId()));
    }

    @PatchMapping("/{transactionId}/category")
    public ResponseEntity<CategoryUpdateResponseDto> updateCategory(
            @PathVariable("transactionId") UUID transactionId,
            @RequestBody @Valid CategoryUpdateRequestDto request
    ) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        var result = categorizationService.updateTransactionCategory(
                userId,
                transactionId,
                request.category().trim(),
                blankToNull(request.subcategory())
        );
        return ResponseEntity.ok(new CategoryUpdateResponseDto(
                transactionId.toString(),
                result.updated(),
                result.autoCategorizedCount(),
                result.newRuleCreated(),
                result.previousCategory(),
                currentTraceId()
        ));
    }

    @PostMapping("/{transactionId}/categorize")
    public ResponseEntity<SingleCategorizationResponseDto> categorize(@PathVariable("transactionId") UUID transactionId) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        var result = categorizationService.categorizeTransaction(userId, transactionId);
        return ResponseEntity.ok(new SingleCategorizationResponseDto(result.matched(), TransactionResponseDto.from(result.transaction())));
    }

    @GetMapping("/{transactionId}/suggestions")
    public ResponseEntity<CategorySuggestionsResponseDto> suggestions(@PathVariable("transactionId") UUID transactionId) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        List<SuggestionDto> suggestions = categorizationService.suggestCategories(userId, transactionId).stream()
                .map(this::map)
                .toList();
        return ResponseEntity.ok(new CategorySuggestionsResponseDto(transactionId.toString(), suggestions));
    }

    private SuggestionDto map(CategorySuggestion suggestion) {
        return new SuggestionDto(
                suggestion.category(),
                suggestion.subcategory(),
                suggestion.confidence(),
                suggestion.method().name(),
                suggestion.ruleId() == null ? null : suggestion.ruleId().toString()
        );
    }

    static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    static String currentTraceId() {
        return RequestContextHolder.currentTraceId().orElse(null);
    }
}
