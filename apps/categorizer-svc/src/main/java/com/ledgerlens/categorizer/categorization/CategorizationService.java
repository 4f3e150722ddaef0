package com.ledgerlens.categorizer.categorization;

import com.ledgerlens.categorizer.categorization.CategoryPredictor.CategoryPrediction;
import com.ledgerlens.categorizer.common.RuleNotFoundException;
import com.ledgerlens.categorizer.common.TransactionNotFoundException;
import com.ledgerlens.categorizer.config.CategorizerProperties;
import com.ledgerlens.categorizer.model.CategorizationMethod;
import com.ledgerlens.categorizer.model.CategorizationRule;
import com.ledgerlens.categorizer.model.PatternType;
import com.ledgerlens.categorizer.model.Transaction;
import com.ledgerlens.categorizer.repository.CategorizationRuleRepository;
import com.ledgerlens.categorizer.repository.TransactionRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Rule based categorization of a user's transactions, plus the manual correction workflow that
 * turns a correction into a rule and propagates it to similar uncategorized transactions.
 *
 * <p>Every public mutation runs in one database transaction. Changes are computed in memory and
 * written with a single {@code saveAll}, so a store failure leaves nothing behind.
 */
@Service
public class CategorizationService {

    private static final Logger log = LoggerFactory.getLogger(CategorizationService.class);
    private static final int MAX_SUGGESTIONS = 5;
    private static final double HIGH_CONFIDENCE = 0.8;
    private static final double MEDIUM_CONFIDENCE = 0.6;
    static final String UNKNOWN_METHOD = "UNKNOWN";

    private final TransactionRepository transactionRepository;
    private final CategorizationRuleRepository ruleRepository;
    private final RuleMatcher ruleMatcher;
    private final TransactionSimilarity similarity;
    private final CategoryPredictor predictor;
    private final CategorizerProperties properties;
    private final Clock clock;

    @Autowired
    public CategorizationService(
            TransactionRepository transactionRepository,
            CategorizationRuleRepository ruleRepository,
            RuleMatcher ruleMatcher,
            TransactionSimilarity similarity,
            CategoryPredictor predictor,
            CategorizerProperties properties
    ) {
        this(transactionRepository, ruleRepository, ruleMatcher, similarity, predictor, properties, Clock.systemUTC());
    }

    CategorizationService(
            TransactionRepository transactionRepository,
            CategorizationRuleRepository ruleRepository,
            RuleMatcher ruleMatcher,
            TransactionSimilarity similarity,
            CategoryPredictor predictor,
            CategorizerProperties properties,
            Clock clock
    ) {
        this.transactionRepository = transactionRepository;
        this.ruleRepository = ruleRepository;
        this.ruleMatcher = ruleMatcher;
        this.similarity = similarity;
        this.predictor = predictor;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional
    public BatchCategorizationResult categorizeUserTransactions(UUID userId, Optional<String> batchId) {
        List<Transaction> pending = transactionRepository.findUncategorized(userId, batchId);
        return categorizeBatch(userId, pending, properties.categorization().mlFallbackEnabledFlag(), "batch " + batchId.orElse("*"));
    }

    /**
     * Same passes as {@link #categorizeUserTransactions} over the listed transactions. Ids that are
     * unknown, owned by another user or already categorized are left out of the totals.
     */
    @Transactional
    public BatchCategorizationResult categorizeTransactionsByIds(UUID userId, List<UUID> transactionIds, boolean useMlFallback) {
        if (transactionIds == null || transactionIds.isEmpty()) {
            throw new IllegalArgumentException("At least one transaction id is required");
        }
        List<Transaction> pending = transactionRepository.findByIdsAndUserId(transactionIds, userId).stream()
                .filter(transaction -> !transaction.categorized())
                .toList();
        boolean mlFallback = useMlFallback && properties.categorization().mlFallbackEnabledFlag();
        return categorizeBatch(userId, pending, mlFallback, transactionIds.size() + " requested id(s)");
    }

    private BatchCategorizationResult categorizeBatch(UUID userId, List<Transaction> pending, boolean mlFallback, String scope) {
        if (pending.isEmpty()) {
            return new BatchCategorizationResult(0, 0, 0, 0);
        }
        List<CategorizationRule> rules = ruleRepository.findActiveByUserId(userId);

        List<Transaction> changed = new ArrayList<>();
        List<Transaction> unmatched = new ArrayList<>();
        for (Transaction transaction : pending) {
            applyRules(transaction, rules).ifPresentOrElse(changed::add, () -> unmatched.add(transaction));
        }
        int ruleCategorized = changed.size();

        int mlCategorized = 0;
        if (mlFallback) {
            for (Transaction transaction : unmatched) {
                Optional<Transaction> predicted = applyPrediction(transaction);
                if (predicted.isPresent()) {
                    changed.add(predicted.get());
                    mlCategorized++;
                }
            }
        }
        int failed = pending.size() - ruleCategorized - mlCategorized;

        if (!changed.isEmpty()) {
            transactionRepository.saveAll(changed);
        }
        log.info("Categorized user {} {}: total={} rule={} ml={} failed={}",
                userId, scope, pending.size(), ruleCategorized, mlCategorized, failed);
        return new BatchCategorizationResult(pending.size(), ruleCategorized, mlCategorized, failed);
    }

    /**
     * Runs the rule pass for one transaction and saves it when a rule matched.
     *
     * @return whether any active rule of the owner matched
     */
    @Transactional
    public boolean categorizeSingleTransaction(Transaction transaction) {
        Optional<Transaction> categorized = applyRules(transaction, ruleRepository.findActiveByUserId(transaction.userId()));
        categorized.ifPresent(transactionRepository::save);
        return categorized.isPresent();
    }

    @Transactional
    public SingleCategorizationResult categorizeTransaction(UUID userId, UUID transactionId) {
        Transaction transaction = requireTransaction(userId, transactionId);
        Optional<Transaction> categorized = applyRules(transaction, ruleRepository.findActiveByUserId(userId));
        if (categorized.isPresent()) {
            return new SingleCategorizationResult(transactionRepository.save(categorized.get()), true);
        }
        return new SingleCategorizationResult(transaction, false);
    }

    /**
     * First matching rule wins. Rules must already be in evaluation order.
     */
    Optional<Transaction> applyRules(Transaction transaction, List<CategorizationRule> rules) {
        for (CategorizationRule rule : rules) {
            if (ruleMatcher.matches(rule, transaction)) {
                log.debug("Rule {} matched transaction {}", rule.id(), transaction.id());
                return Optional.of(transaction.withCategorization(
                        rule.category(),
                        rule.subcategory(),
                        CategorizationMethod.RULE.defaultConfidence(),
                        CategorizationMethod.RULE
                ));
            }
        }
        return Optional.empty();
    }

    @Transactional
    public CategoryUpdateResult updateTransactionCategory(UUID userId, UUID transactionId, String category, String subcategory) {
        requireCategory(category);
        Transaction existing = requireTransaction(userId, transactionId);
        String previousCategory = existing.category();
        Transaction corrected = existing.withCategorization(
                category,
                subcategory,
                CategorizationMethod.MANUAL.defaultConfidence(),
                CategorizationMethod.MANUAL
        );

        boolean newRuleCreated = deriveRuleKey(corrected)
                .map(key -> upsertCorrectionRule(userId, key, category, subcategory))
                .orElse(false);

        List<Transaction> propagated = transactionRepository.findUncategorized(userId, Optional.empty()).stream()
                .filter(candidate -> !candidate.id().equals(corrected.id()))
                .filter(candidate -> similarity.isSimilar(candidate, corrected))
                .map(candidate -> candidate.withCategorization(
                        category,
                        subcategory,
                        CategorizationMethod.SIMILARITY.defaultConfidence(),
                        CategorizationMethod.SIMILARITY
                ))
                .toList();

        List<Transaction> changed = new ArrayList<>(propagated.size() + 1);
        changed.add(corrected);
        changed.addAll(propagated);
        transactionRepository.saveAll(changed);

        log.info("User {} recategorized transaction {} to '{}'; {} similar transaction(s) followed",
                userId, transactionId, category, propagated.size());
        return new CategoryUpdateResult(true, propagated.size(), newRuleCreated, previousCategory);
    }

    /**
     * Always stores a new rule at default priority, even when one with the same pattern exists.
     */
    @Transactional
    public CategorizationRule createRuleFromCorrection(UUID userId, UUID transactionId, String category, String subcategory) {
        requireCategory(category);
        Transaction transaction = requireTransaction(userId, transactionId);
        RuleKey key = deriveRuleKey(transaction)
                .orElseThrow(() -> new IllegalArgumentException("Transaction has no vendor or description token to build a rule from"));
        Instant now = clock.instant();
        CategorizationRule created = ruleRepository.save(new CategorizationRule(
                UUID.randomUUID(),
                userId,
                key.pattern(),
                key.patternType(),
                category,
                subcategory,
                CategorizationRule.DEFAULT_PRIORITY,
                true,
                now,
                now
        ));
        log.info("Created rule {} ({} '{}') from transaction {}", created.id(), key.patternType().value(), key.pattern(), transactionId);
        return created;
    }

    @Transactional(readOnly = true)
    public Map<String, List<String>> getAvailableCategories(UUID userId) {
        Map<String, SortedSet<String>> collected = new TreeMap<>();
        for (Transaction transaction : transactionRepository.findCategorized(userId)) {
            collect(collected, transaction.category(), transaction.subcategory());
        }
        for (CategorizationRule rule : ruleRepository.findActiveByUserId(userId)) {
            collect(collected, rule.category(), rule.subcategory());
        }
        Map<String, List<String>> result = new LinkedHashMap<>();
        collected.forEach((category, subcategories) -> result.put(category, List.copyOf(subcategories)));
        return result;
    }

    @Transactional
    public RuleApplicationResult applyRuleToExistingTransactions(UUID userId, UUID ruleId, boolean forceRecategorize) {
        CategorizationRule rule = ruleRepository.findByIdAndUserId(ruleId, userId)
                .filter(CategorizationRule::active)
                .orElseThrow(() -> new RuleNotFoundException(ruleId));
        List<Transaction> candidates = forceRecategorize
                ? transactionRepository.findByUserId(userId)
                : transactionRepository.findUncategorized(userId, Optional.empty());

        List<Transaction> matched = candidates.stream()
                .filter(transaction -> ruleMatcher.matches(rule, transaction))
                .map(transaction -> transaction.withCategorization(
                        rule.category(),
                        rule.subcategory(),
                        CategorizationMethod.RULE.defaultConfidence(),
                        CategorizationMethod.RULE
                ))
                .toList();
        if (!matched.isEmpty()) {
            transactionRepository.saveAll(matched);
        }
        log.info("Applied rule {} to user {}: matched {} of {} (force={})",
                ruleId, userId, matched.size(), candidates.size(), forceRecategorize);
        return new RuleApplicationResult(rule.id(), rule.pattern(), matched.size(), candidates.size());
    }

    @Transactional(readOnly = true)
    public List<CategorySuggestion> suggestCategories(UUID userId, UUID transactionId) {
        Transaction transaction = requireTransaction(userId, transactionId);
        List<CategorySuggestion> suggestions = new ArrayList<>();
        for (CategorizationRule rule : ruleRepository.findActiveByUserId(userId)) {
            if (ruleMatcher.matches(rule, transaction)) {
                suggestions.add(new CategorySuggestion(
                        rule.category(),
                        rule.subcategory(),
                        CategorizationMethod.RULE.defaultConfidence(),
                        CategorizationMethod.RULE,
                        rule.id()
                ));
            }
        }
        double minimum = properties.categorization().suggestionMinConfidenceOrDefault();
        predict(transaction)
                .filter(prediction -> prediction.confidence() >= minimum)
                .ifPresent(prediction -> suggestions.add(new CategorySuggestion(
                        prediction.category(),
                        prediction.subcategory(),
                        prediction.confidence(),
                        CategorizationMethod.ML,
                        null
                )));
        return suggestions.stream()
                .sorted(Comparator.comparingDouble(CategorySuggestion::confidence).reversed())
                .limit(MAX_SUGGESTIONS)
                .toList();
    }

    /**
     * Categorization coverage and confidence over the user's transactions that occurred within
     * the optional bounds, both inclusive.
     */
    @Transactional(readOnly = true)
    public CategorizationPerformance getCategorizationPerformance(UUID userId, Optional<Instant> from, Optional<Instant> to) {
        List<Transaction> transactions = transactionRepository.findByUserId(userId).stream()
                .filter(transaction -> from.map(start -> !transaction.occurredAt().isBefore(start)).orElse(true))
                .filter(transaction -> to.map(end -> !transaction.occurredAt().isAfter(end)).orElse(true))
                .toList();
        List<Transaction> categorized = transactions.stream().filter(Transaction::categorized).toList();

        Map<String, Integer> methods = new LinkedHashMap<>();
        for (CategorizationMethod method : CategorizationMethod.values()) {
            methods.put(method.name(), 0);
        }
        methods.put(UNKNOWN_METHOD, 0);
        int high = 0;
        int medium = 0;
        int low = 0;
        double confidenceSum = 0.0;
        Map<String, CategoryAccumulator> perCategory = new TreeMap<>();
        for (Transaction transaction : categorized) {
            String method = transaction.categorizationMethod() == null ? UNKNOWN_METHOD : transaction.categorizationMethod().name();
            methods.merge(method, 1, Integer::sum);

            double confidence = Optional.ofNullable(transaction.confidenceScore()).orElse(0.0);
            confidenceSum += confidence;
            if (confidence >= HIGH_CONFIDENCE) {
                high++;
            } else if (confidence >= MEDIUM_CONFIDENCE) {
                medium++;
            } else {
                low++;
            }
            perCategory.computeIfAbsent(transaction.category(), key -> new CategoryAccumulator())
                    .add(transaction.amount().abs(), confidence);
        }

        Map<String, CategoryStats> categories = new LinkedHashMap<>();
        perCategory.forEach((category, accumulator) -> categories.put(category, accumulator.toStats()));
        int total = transactions.size();
        return new CategorizationPerformance(
                total,
                categorized.size(),
                total - categorized.size(),
                total == 0 ? 0.0 : (double) categorized.size() / total,
                categorized.isEmpty() ? 0.0 : confidenceSum / categorized.size(),
                methods,
                new ConfidenceDistribution(high, medium, low),
                categories
        );
    }

    private Optional<Transaction> applyPrediction(Transaction transaction) {
        double minimum = properties.categorization().mlMinConfidenceOrDefault();
        return predict(transaction)
                .filter(prediction -> prediction.confidence() >= minimum)
                .map(prediction -> transaction.withCategorization(
                        prediction.category(),
                        prediction.subcategory(),
                        prediction.confidence(),
                        CategorizationMethod.ML
                ));
    }

    // A failing model only costs the fallback for that transaction
    private Optional<CategoryPrediction> predict(Transaction transaction) {
        try {
            return predictor.predict(transaction);
        } catch (RuntimeException ex) {
            log.warn("Category prediction failed for transaction {}: {}", transaction.id(), ex.getMessage());
            return Optional.empty();
        }
    }

    private boolean upsertCorrectionRule(UUID userId, RuleKey key, String category, String subcategory) {
        Instant now = clock.instant();
        Optional<CategorizationRule> existing = ruleRepository.findByPatternKey(userId, key.pattern(), key.patternType());
        if (existing.isPresent()) {
            ruleRepository.save(existing.get().withTarget(category, subcategory, CategorizationRule.USER_CORRECTION_PRIORITY, now));
            return false;
        }
        CategorizationRule created = ruleRepository.save(new CategorizationRule(
                UUID.randomUUID(),
                userId,
                key.pattern(),
                key.patternType(),
                category,
                subcategory,
                CategorizationRule.USER_CORRECTION_PRIORITY,
                true,
                now,
                now
        ));
        log.info("Created rule {} ({} '{}') for user {}", created.id(), key.patternType().value(), key.pattern(), userId);
        return true;
    }

    /**
     * Vendor when present, otherwise the first word of the description as typed.
     */
    static Optional<RuleKey> deriveRuleKey(Transaction transaction) {
        Optional<String> vendor = transaction.vendorName();
        if (vendor.isPresent()) {
            return Optional.of(new RuleKey(fitPattern(vendor.get()), PatternType.VENDOR));
        }
        String description = transaction.description().trim();
        if (description.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new RuleKey(fitPattern(description.split("\\s+")[0]), PatternType.KEYWORD));
    }

    // A prefix of the token still matches every transaction the full token would
    private static String fitPattern(String pattern) {
        return pattern.length() <= CategorizationRule.MAX_STORED_PATTERN_LENGTH
                ? pattern
                : pattern.substring(0, CategorizationRule.MAX_STORED_PATTERN_LENGTH);
    }

    private Transaction requireTransaction(UUID userId, UUID transactionId) {
        return transactionRepository.findByIdAndUserId(transactionId, userId)
                .orElseThrow(() -> new TransactionNotFoundException(transactionId));
    }

    private static void requireCategory(String category) {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("category must not be blank");
        }
    }

    private static void collect(Map<String, SortedSet<String>> collected, String category, String subcategory) {
        if (category == null) {
            return;
        }
        SortedSet<String> subcategories = collected.computeIfAbsent(category, key -> new TreeSet<>());
        if (subcategory != null && !subcategory.isBlank()) {
            subcategories.add(subcategory);
        }
    }

    record RuleKey(String pattern, PatternType patternType) {
    }

    public record BatchCategorizationResult(int totalTransactions, int ruleCategorized, int mlCategorized, int failed) {
        public int categorizedCount() {
            return ruleCategorized + mlCategorized;
        }

        public double successRate() {
            return totalTransactions == 0 ? 0.0 : (double) categorizedCount() / totalTransactions;
        }
    }

    public record SingleCategorizationResult(Transaction transaction, boolean matched) {
    }

    public record CategoryUpdateResult(boolean updated, int autoCategorizedCount, boolean newRuleCreated, String previousCategory) {
    }

    public record RuleApplicationResult(UUID ruleId, String pattern, int categorizedCount, int totalProcessed) {
    }

    public record CategorySuggestion(
            String category,
            String subcategory,
            double confidence,
            CategorizationMethod method,
            UUID ruleId
    ) {
    }

    public record CategorizationPerformance(
            int totalTransactions,
            int categorizedCount,
            int uncategorizedCount,
            double categorizationRate,
            double averageConfidence,
            Map<String, Integer> methods,
            ConfidenceDistribution confidenceDistribution,
            Map<String, CategoryStats> categories
    ) {
    }

    /**
     * High is 0.8 and above, medium from 0.6, low below that.
     */
    public record ConfidenceDistribution(int high, int medium, int low) {
    }

    public record CategoryStats(int count, BigDecimal totalAmount, double averageConfidence) {
    }

    private static final class CategoryAccumulator {
        private int count;
        private BigDecimal totalAmount = BigDecimal.ZERO;
        private double confidenceSum;

        void add(BigDecimal amount, double confidence) {
            count++;
            totalAmount = totalAmount.add(amount);
            confidenceSum += confidence;
        }

        CategoryStats toStats() {
            return new CategoryStats(count, totalAmount, confidenceSum / count);
        }
    }
}
