package com.ledgerlens.categorizer.service;

import com.ledgerlens.categorizer.categorization.CategorizationService;
import com.ledgerlens.categorizer.categorization.CategorizationService.BatchCategorizationResult;
import com.ledgerlens.categorizer.model.Transaction;
import com.ledgerlens.categorizer.repository.TransactionRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TransactionImportService {

    private static final Logger log = LoggerFactory.getLogger(TransactionImportService.class);

    // numeric(12,2) in the transactions table
    static final int AMOUNT_INTEGER_DIGITS = 10;
    static final int AMOUNT_FRACTION_DIGITS = 2;

    private final TransactionRepository transactionRepository;
    private final CategorizationService categorizationService;

    public TransactionImportService(
            TransactionRepository transactionRepository,
            CategorizationService categorizationService
    ) {
        this.transactionRepository = transactionRepository;
        this.categorizationService = categorizationService;
    }

    /**
     * Stores the rows as one uncategorized import batch and runs categorization over that batch.
     */
    @Transactional
    public ImportResult importTransactions(UUID userId, List<ImportRow> rows) {
        if (rows == null || rows.isEmpty()) {
            throw new IllegalArgumentException("At least one transaction row is required");
        }
        String batchId = UUID.randomUUID().toString();
        List<Transaction> imported = rows.stream()
                .map(row -> toTransaction(userId, batchId, row))
                .toList();
        transactionRepository.saveAll(imported);
        log.info("Imported {} transaction(s) for user {} as batch {}", imported.size(), userId, batchId);

        BatchCategorizationResult categorization = categorizationService.categorizeUserTransactions(userId, Optional.of(batchId));
        return new ImportResult(batchId, imported.size(), categorization);
    }

    @Transactional(readOnly = true)
    public List<Transaction> listTransactions(UUID userId, boolean uncategorizedOnly) {
        if (uncategorizedOnly) {
            return transactionRepository.findUncategorized(userId, Optional.empty());
        }
        return transactionRepository.findByUserId(userId);
    }

    private static Transaction toTransaction(UUID userId, String batchId, ImportRow row) {
        if (row.description() == null || row.description().isBlank()) {
            throw new IllegalArgumentException("Transaction description must not be blank");
        }
        if (row.amount() == null) {
            throw new IllegalArgumentException("Transaction amount is required");
        }
        if (row.amount().scale() > AMOUNT_FRACTION_DIGITS
                || row.amount().precision() - row.amount().scale() > AMOUNT_INTEGER_DIGITS) {
            throw new IllegalArgumentException("Transaction amount must have at most "
                    + AMOUNT_INTEGER_DIGITS + " integer digits and " + AMOUNT_FRACTION_DIGITS + " decimals");
        }
        String vendor = row.vendor() == null || row.vendor().isBlank() ? null : row.vendor().trim();
        return Transaction.uncategorized(
                UUID.randomUUID(),
                userId,
                batchId,
                row.description().trim(),
                vendor,
                row.amount(),
                Optional.ofNullable(row.occurredAt()).orElseGet(Instant::now)
        );
    }

    public record ImportRow(String description, String vendor, BigDecimal amount, Instant occurredAt) {
    }

    public record ImportResult(String batchId, int importedCount, BatchCategorizationResult categorization) {
    }
}
