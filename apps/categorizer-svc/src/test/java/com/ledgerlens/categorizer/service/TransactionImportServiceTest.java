package com.ledgerlens.categorizer.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ledgerlens.categorizer.categorization.CategorizationService;
import com.ledgerlens.categorizer.categorization.NoopCategoryPredictor;
import com.ledgerlens.categorizer.categorization.RuleMatcher;
import com.ledgerlens.categorizer.categorization.TransactionSimilarity;
import com.ledgerlens.categorizer.config.CategorizerProperties;
import com.ledgerlens.categorizer.model.CategorizationRule;
import com.ledgerlens.categorizer.model.PatternType;
import com.ledgerlens.categorizer.model.Transaction;
import com.ledgerlens.categorizer.repository.InMemoryCategorizationRuleRepository;
import com.ledgerlens.categorizer.repository.InMemoryTransactionRepository;
import com.ledgerlens.categorizer.service.TransactionImportService.ImportResult;
import com.ledgerlens.categorizer.service.TransactionImportService.ImportRow;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TransactionImportServiceTest {

    private InMemoryTransactionRepository transactionRepository;
    private InMemoryCategorizationRuleRepository ruleRepository;
    private TransactionImportService service;

    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        transactionRepository = new InMemoryTransactionRepository();
        ruleRepository = new InMemoryCategorizationRuleRepository();
        CategorizerProperties properties = new CategorizerProperties(
                new CategorizerProperties.Security("0123456789abcdef0123456789abcdef", null), null);
        CategorizationService categorizationService = new CategorizationService(
                transactionRepository, ruleRepository, new RuleMatcher(), new TransactionSimilarity(), new NoopCategoryPredictor(), properties);
        service = new TransactionImportService(transactionRepository, categorizationService);
    }

    @Test
    void importStoresBatchAndCategorizesOnlyThatBatch() {
        Transaction earlier = transactionRepository.save(
                Transaction.uncategorized(UUID.randomUUID(), userId, "old", "RENT APRIL", null, BigDecimal.TEN, Instant.now()));
        Instant now = Instant.now();
        ruleRepository.save(new CategorizationRule(UUID.randomUUID(), userId, "rent", PatternType.KEYWORD, "Housing", "Rent", 1, true, now, now));

        ImportResult result = service.importTransactions(userId, List.of(
                new ImportRow(" RENT MAY ", " ", new BigDecimal("-1500.00"), now),
                new ImportRow("CORNER BAKERY", "Corner Bakery", new BigDecimal("-8.20"), null)
        ));

        assertThat(result.importedCount()).isEqualTo(2);
        assertThat(result.categorization().totalTransactions()).isEqualTo(2);
        assertThat(result.categorization().categorizedCount()).isEqualTo(1);
        assertThat(transactionRepository.findUncategorized(userId, Optional.of(result.batchId())))
                .extracting(Transaction::description)
                .containsExactly("CORNER BAKERY");
        assertThat(transactionRepository.findByIdAndUserId(earlier.id(), userId).orElseThrow().categorized()).isFalse();

        Transaction rent = service.listTransactions(userId, false).stream()
                .filter(tx -> tx.description().equals("RENT MAY"))
                .findFirst()
                .orElseThrow();
        assertThat(rent.vendor()).isEmpty();
        assertThat(rent.importBatch()).contains(result.batchId());
        assertThat(rent.category()).isEqualTo("Housing");
    }

    @Test
    void listCanFilterToUncategorized() {
        service.importTransactions(userId, List.of(new ImportRow("MYSTERY", null, BigDecimal.ONE, Instant.now())));

        assertThat(service.listTransactions(userId, true)).hasSize(1);
        assertThat(service.listTransactions(UUID.randomUUID(), false)).isEmpty();
    }

    @Test
    void rejectsEmptyImportsAndBlankDescriptions() {
        assertThatThrownBy(() -> service.importTransactions(userId, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.importTransactions(userId, List.of(new ImportRow(" ", null, BigDecimal.ONE, null))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(transactionRepository.findByUserId(userId)).isEmpty();
    }

    @Test
    void rejectsAmountsThatDoNotFitTheLedgerColumn() {
        assertThatThrownBy(() -> service.importTransactions(userId, List.of(
                new ImportRow("BIG", null, new BigDecimal("123456789012.00"), null))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("integer digits");
        assertThatThrownBy(() -> service.importTransactions(userId, List.of(
                new ImportRow("FRACTION", null, new BigDecimal("1.005"), null))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(transactionRepository.findByUserId(userId)).isEmpty();

        ImportResult largest = service.importTransactions(userId, List.of(
                new ImportRow("LARGEST", null, new BigDecimal("-9999999999.99"), null)));
        assertThat(largest.importedCount()).isEqualTo(1);
    }
}
