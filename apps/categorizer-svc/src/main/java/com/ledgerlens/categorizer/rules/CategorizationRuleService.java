package com.ledgerlens.categorizer.rules;

import com.ledgerlens.categorizer.categorization.CategorizationService;
import com.ledgerlens.categorizer.categorization.RuleMatcher;
import com.ledgerlens.categorizer.common.RuleNotFoundException;
import com.ledgerlens.categorizer.model.CategorizationRule;
import com.ledgerlens.categorizer.model.PatternType;
import com.ledgerlens.categorizer.model.Transaction;
import com.ledgerlens.categorizer.repository.CategorizationRuleRepository;
import com.ledgerlens.categorizer.repository.TransactionRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class CategorizationRuleService {

    private static final Logger log = LoggerFactory.getLogger(CategorizationRuleService.class);

    static final int MAX_PATTERN_LENGTH = 255;
    static final int MAX_CATEGORY_LENGTH = 100;
    static final int DEFAULT_TEST_LIMIT = 10;
    static final int MAX_TEST_LIMIT = 100;

    private final CategorizationRuleRepository ruleRepository;
    private final TransactionRepository transactionRepository;
    private final CategorizationService categorizationService;
    private final RuleMatcher ruleMatcher;
    private final Clock clock;

    @Autowired
    public CategorizationRuleService(
            CategorizationRuleRepository ruleRepository,
            TransactionRepository transactionRepository,
            CategorizationService categorizationService,
            RuleMatcher ruleMatcher
    ) {
        this(ruleRepository, transactionRepository, categorizationService, ruleMatcher, Clock.systemUTC());
    }

    CategorizationRuleService(
            CategorizationRuleRepository ruleRepository,
            TransactionRepository transactionRepository,
            CategorizationService categorizationService,
            RuleMatcher ruleMatcher,
            Clock clock
    ) {
        this.ruleRepository = ruleRepository;
        this.transactionRepository = transactionRepository;
        this.categorizationService = categorizationService;
        this.ruleMatcher = ruleMatcher;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<CategorizationRule> listRules(UUID userId, boolean activeOnly) {
        return activeOnly ? ruleRepository.findActiveByUserId(userId) : ruleRepository.findByUserId(userId);
    }

    @Transactional(readOnly = true)
    public CategorizationRule getRule(UUID userId, UUID ruleId) {
        return requireRule(userId, ruleId);
    }

    @Transactional
    public CategorizationRule createRule(UUID userId, RuleDraft draft) {
        List<String> errors = definitionErrors(draft.pattern(), draft.patternType(), draft.category(), draft.subcategory());
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException(String.join("; ", errors));
        }
        Instant now = clock.instant();
        CategorizationRule created = ruleRepository.save(new CategorizationRule(
                UUID.randomUUID(),
                userId,
                draft.pattern().trim(),
                draft.patternType(),
                draft.category().trim(),
                normalizeSubcategory(draft.subcategory()),
                Optional.ofNullable(draft.priority()).orElse(CategorizationRule.DEFAULT_PRIORITY),
                Optional.ofNullable(draft.active()).orElse(Boolean.TRUE),
                now,
                now
        ));
        log.info("Created rule {} for user {} ({} '{}' -> {})",
                created.id(), userId, created.patternType().value(), created.pattern(), created.category());
        return created;
    }

    /**
     * Applies only the fields present in {@code changes}, then validates the merged rule.
     */
    @Transactional
    public CategorizationRule updateRule(UUID userId, UUID ruleId, RuleChanges changes) {
        CategorizationRule existing = requireRule(userId, ruleId);
        String pattern = changes.pattern().map(String::trim).orElse(existing.pattern());
        PatternType patternType = changes.patternType().orElse(existing.patternType());
        String category = changes.category().map(String::trim).orElse(existing.category());
        String subcategory = changes.subcategory().isPresent()
                ? normalizeSubcategory(changes.subcategory().get())
                : existing.subcategory();

        List<String> errors = definitionErrors(pattern, patternType, category, subcategory);
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException(String.join("; ", errors));
        }
        CategorizationRule updated = ruleRepository.save(existing.withDefinition(
                pattern,
                patternType,
                category,
                subcategory,
                changes.priority().orElse(existing.priority()),
                changes.active().orElse(existing.active()),
                clock.instant()
        ));
        if (!existing.pattern().equals(updated.pattern())) {
            ruleMatcher.evict(existing.pattern());
        }
        log.info("Updated rule {} for user {}", ruleId, userId);
        return updated;
    }

    @Transactional
    public void deleteRule(UUID userId, UUID ruleId) {
        CategorizationRule rule = requireRule(userId, ruleId);
        ruleRepository.delete(rule);
        ruleMatcher.evict(rule.pattern());
        log.info("Deleted rule {} for user {}", ruleId, userId);
    }

    /**
     * Dry run of a pattern over all of the user's transactions. Nothing is written.
     */
    @Transactional(readOnly = true)
    public RuleTestResult testRule(UUID userId, String pattern, PatternType patternType, Integer limit) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("pattern must not be blank");
        }
        int sampleSize = Math.max(1, Math.min(Optional.ofNullable(limit).orElse(DEFAULT_TEST_LIMIT), MAX_TEST_LIMIT));
        List<Transaction> transactions = transactionRepository.findByUserId(userId);
        Predicate<Transaction> matcher = ruleMatcher.transientMatcher(pattern, patternType);
        List<Transaction> matches = transactions.stream()
                .filter(matcher)
                .toList();
        double matchRate = transactions.isEmpty() ? 0.0 : (double) matches.size() / transactions.size();
        return new RuleTestResult(
                pattern,
                patternType,
                matches.size(),
                transactions.size(),
                matchRate,
                matches.stream().limit(sampleSize).toList(),
                detectConflicts(userId, pattern, patternType, null)
        );
    }

    @Transactional(readOnly = true)
    public RuleValidationResult validateRule(
            UUID userId,
            String pattern,
            PatternType patternType,
            String category,
            String subcategory,
            UUID excludeRuleId
    ) {
        List<String> errors = definitionErrors(pattern, patternType, category, subcategory);
        List<String> warnings = new ArrayList<>();
        if (patternType == PatternType.EXACT || patternType == PatternType.CONTAINS) {
            warnings.add("Pattern type '" + patternType.value() + "' is stored but not evaluated during categorization");
        }
        Map<String, List<String>> known = categorizationService.getAvailableCategories(userId);
        if (category != null && !category.isBlank()) {
            if (!known.containsKey(category.trim())) {
                warnings.add("Category '" + category.trim() + "' does not exist yet and will be created");
            } else if (subcategory != null && !subcategory.isBlank()
                    && !known.get(category.trim()).contains(subcategory.trim())) {
                warnings.add("Subcategory '" + subcategory.trim() + "' does not exist in category '" + category.trim() + "'");
            }
        }
        List<RuleConflict> conflicts = pattern == null || patternType == null
                ? List.of()
                : detectConflicts(userId, pattern, patternType, excludeRuleId);
        return new RuleValidationResult(errors.isEmpty(), errors, warnings, conflicts);
    }

    List<RuleConflict> detectConflicts(UUID userId, String pattern, PatternType patternType, UUID excludeRuleId) {
        List<RuleConflict> conflicts = new ArrayList<>();
        for (CategorizationRule rule : ruleRepository.findActiveByUserId(userId)) {
            if (rule.id().equals(excludeRuleId)) {
                continue;
            }
            if (rule.pattern().equals(pattern) && rule.patternType() == patternType) {
                conflicts.add(new RuleConflict(rule.id(), rule.pattern(), ConflictType.DUPLICATE));
            } else if (overlaps(pattern, patternType, rule.pattern(), rule.patternType())) {
                conflicts.add(new RuleConflict(rule.id(), rule.pattern(), ConflictType.OVERLAP));
            }
        }
        return conflicts;
    }

    private static boolean overlaps(String pattern, PatternType type, String otherPattern, PatternType otherType) {
        if (type != otherType || (type != PatternType.KEYWORD && type != PatternType.CONTAINS)) {
            return false;
        }
        String left = pattern.toLowerCase(Locale.ROOT);
        String right = otherPattern.toLowerCase(Locale.ROOT);
        return left.contains(right) || right.contains(left);
    }

    private List<String> definitionErrors(String pattern, PatternType patternType, String category, String subcategory) {
        List<String> errors = new ArrayList<>();
        if (pattern == null || pattern.isBlank()) {
            errors.add("Pattern cannot be empty");
        } else if (pattern.trim().length() > MAX_PATTERN_LENGTH) {
            errors.add("Pattern must be at most " + MAX_PATTERN_LENGTH + " characters");
        }
        if (patternType == null) {
            errors.add("Pattern type is required");
        }
        if (category == null || category.isBlank()) {
            errors.add("Category cannot be empty");
        } else if (category.trim().length() > MAX_CATEGORY_LENGTH) {
            errors.add("Category must be at most " + MAX_CATEGORY_LENGTH + " characters");
        }
        if (subcategory != null && subcategory.trim().length() > MAX_CATEGORY_LENGTH) {
            errors.add("Subcategory must be at most " + MAX_CATEGORY_LENGTH + " characters");
        }
        if (patternType == PatternType.REGEX && pattern != null && !pattern.isBlank()) {
            ruleMatcher.regexError(pattern).ifPresent(error -> errors.add("Invalid regex pattern: " + error));
        }
        return errors;
    }

    private static String normalizeSubcategory(String subcategory) {
        if (subcategory == null || subcategory.isBlank()) {
            return null;
        }
        return subcategory.trim();
    }

    private CategorizationRule requireRule(UUID userId, UUID ruleId) {
        return ruleRepository.findByIdAndUserId(ruleId, userId)
                .orElseThrow(() -> new RuleNotFoundException(ruleId));
    }

    public record RuleDraft(
            String pattern,
            PatternType patternType,
            String category,
            String subcategory,
            Integer priority,
            Boolean active
    ) {
    }

    /**
     * Partial update. An empty optional leaves the field as it is; a present blank subcategory clears it.
     */
    public record RuleChanges(
            Optional<String> pattern,
            Optional<PatternType> patternType,
            Optional<String> category,
            Optional<String> subcategory,
            Optional<Integer> priority,
            Optional<Boolean> active
    ) {
        public RuleChanges {
            pattern = pattern == null ? Optional.empty() : pattern;
            patternType = patternType == null ? Optional.empty() : patternType;
            category = category == null ? Optional.empty() : category;
            subcategory = subcategory == null ? Optional.empty() : subcategory;
            priority = priority == null ? Optional.empty() : priority;
            active = active == null ? Optional.empty() : active;
        }
    }

    public record RuleTestResult(
            String pattern,
            PatternType patternType,
            int matchesFound,
            int totalTransactions,
            double matchRate,
            List<Transaction> sampleMatches,
            List<RuleConflict> potentialConflicts
    ) {
    }

    public record RuleValidationResult(
            boolean valid,
            List<String> errors,
            List<String> warnings,
            List<RuleConflict> conflicts
    ) {
    }

    public enum ConflictType {
        DUPLICATE,
        OVERLAP
    }

    public record RuleConflict(UUID ruleId, String pattern, ConflictType type) {
    }
}
