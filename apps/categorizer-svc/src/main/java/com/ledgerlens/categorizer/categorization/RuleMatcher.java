package com.ledgerlens.categorizer.categorization;

import com.ledgerlens.categorizer.model.CategorizationRule;
import com.ledgerlens.categorizer.model.PatternType;
import com.ledgerlens.categorizer.model.Transaction;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Evaluates a single rule against a transaction. All comparisons ignore case.
 */
@Component
public class RuleMatcher {

    private static final Logger log = LoggerFactory.getLogger(RuleMatcher.class);

    // Invalid patterns are cached as empty so they are reported once
    private final Map<String, Optional<Pattern>> compiledPatterns = new ConcurrentHashMap<>();

    public boolean matches(CategorizationRule rule, Transaction transaction) {
        return matches(rule.pattern(), rule.patternType(), transaction, this::compile);
    }

    /**
     * Matcher for a pattern that is not a stored rule, such as a dry run. The regex is compiled
     * once for the returned predicate and never enters the shared cache.
     */
    public Predicate<Transaction> transientMatcher(String pattern, PatternType patternType) {
        Optional<Pattern> compiled = patternType == PatternType.REGEX && pattern != null
                ? tryCompile(pattern)
                : Optional.empty();
        return transaction -> matches(pattern, patternType, transaction, key -> compiled);
    }

    /**
     * Drops the compiled form of a pattern whose rule changed or was removed.
     */
    public void evict(String pattern) {
        if (pattern != null) {
            compiledPatterns.remove(pattern);
        }
    }

    int cachedPatternCount() {
        return compiledPatterns.size();
    }

    private static boolean matches(
            String pattern,
            PatternType patternType,
            Transaction transaction,
            Function<String, Optional<Pattern>> compiler
    ) {
        if (pattern == null) {
            return false;
        }
        return switch (patternType) {
            case KEYWORD -> containsIgnoreCase(transaction.description(), pattern);
            case VENDOR -> transaction.vendorName()
                    .map(vendor -> containsIgnoreCase(vendor, pattern))
                    .orElse(false);
            case REGEX -> compiler.apply(pattern)
                    .map(regex -> regex.matcher(transaction.description()).find())
                    .orElse(false);
            // Accepted by the rules API but never evaluated
            case EXACT, CONTAINS -> false;
        };
    }

    /**
     * Compiles the pattern the way rule evaluation does, without caching, for validation.
     */
    public Optional<String> regexError(String pattern) {
        try {
            Pattern.compile(pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            return Optional.empty();
        } catch (PatternSyntaxException ex) {
            return Optional.of(ex.getDescription());
        }
    }

    private Optional<Pattern> compile(String pattern) {
        return compiledPatterns.computeIfAbsent(pattern, RuleMatcher::tryCompile);
    }

    private static Optional<Pattern> tryCompile(String pattern) {
        try {
            return Optional.of(Pattern.compile(pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
        } catch (PatternSyntaxException ex) {
            log.warn("Invalid regex pattern '{}': {}", pattern, ex.getDescription());
            return Optional.empty();
        }
    }

    private static boolean containsIgnoreCase(String text, String fragment) {
        return text.toLowerCase(Locale.ROOT).contains(fragment.toLowerCase(Locale.ROOT));
    }
}
