package com.ledgerlens.categorizer.categorization;

import static org.assertj.core.api.Assertions.assertThat;

import com.ledgerlens.categorizer.model.CategorizationRule;
import com.ledgerlens.categorizer.model.PatternType;
import com.ledgerlens.categorizer.model.Transaction;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class RuleMatcherTest {

    private final RuleMatcher matcher = new RuleMatcher();
    private final UUID userId = UUID.randomUUID();

    @Test
    void keywordMatchesDescriptionIgnoringCase() {
        Transaction tx = transaction("COFFEE SHOP PURCHASE", null);

        assertThat(matcher.matches(rule("coffee", PatternType.KEYWORD), tx)).isTrue();
        assertThat(matcher.matches(rule("tea", PatternType.KEYWORD), tx)).isFalse();
    }

    @Test
    void keywordDoesNotLookAtVendor() {
        Transaction tx = transaction("CARD PAYMENT", "Starbucks");

        assertThat(matcher.matches(rule("starbucks", PatternType.KEYWORD), tx)).isFalse();
    }

    @Test
    void vendorMatchesSubstringOfVendor() {
        Transaction tx = transaction("POS 4411", "Shell Oil 123");

        assertThat(matcher.matches(rule("shell", PatternType.VENDOR), tx)).isTrue();
    }

    @Test
    void vendorNeverMatchesWithoutVendor() {
        Transaction missing = transaction("SHELL OIL STATION", null);
        Transaction blank = transaction("SHELL OIL STATION", "  ");

        assertThat(matcher.matches(rule("shell", PatternType.VENDOR), missing)).isFalse();
        assertThat(matcher.matches(rule("shell", PatternType.VENDOR), blank)).isFalse();
    }

    @Test
    void regexSearchesDescriptionIgnoringCase() {
        Transaction tx = transaction("Uber *Trip 8812 San Francisco", null);

        assertThat(matcher.matches(rule("uber\\s+\\*trip", PatternType.REGEX), tx)).isTrue();
        assertThat(matcher.matches(rule("^trip", PatternType.REGEX), tx)).isFalse();
    }

    @Test
    void invalidRegexIsANonMatch() {
        Transaction tx = transaction("anything [ at all", null);

        assertThat(matcher.matches(rule("[unclosed", PatternType.REGEX), tx)).isFalse();
        // second evaluation hits the cached failure
        assertThat(matcher.matches(rule("[unclosed", PatternType.REGEX), tx)).isFalse();
        assertThat(matcher.regexError("[unclosed")).isPresent();
        assertThat(matcher.regexError("ok.*")).isEmpty();
    }

    @Test
    void exactAndContainsAreNeverEvaluated() {
        Transaction tx = transaction("NETFLIX", "Netflix");

        assertThat(matcher.matches(rule("NETFLIX", PatternType.EXACT), tx)).isFalse();
        assertThat(matcher.matches(rule("NETFLIX", PatternType.CONTAINS), tx)).isFalse();
    }

    @Test
    void transientMatchersLeaveTheRuleCacheAlone() {
        Transaction tx = transaction("UBER *TRIP 42", null);

        for (int i = 0; i < 50; i++) {
            assertThat(matcher.transientMatcher("trip " + i + "|uber", PatternType.REGEX).test(tx)).isTrue();
        }
        assertThat(matcher.transientMatcher("[unclosed", PatternType.REGEX).test(tx)).isFalse();
        assertThat(matcher.transientMatcher("uber", PatternType.KEYWORD).test(tx)).isTrue();
        assertThat(matcher.transientMatcher("uber", PatternType.VENDOR).test(tx)).isFalse();

        assertThat(matcher.cachedPatternCount()).isZero();
    }

    @Test
    void evictedPatternsAreDroppedFromTheCache() {
        Transaction tx = transaction("UBER *TRIP 42", null);
        matcher.matches(rule("uber", PatternType.REGEX), tx);
        matcher.matches(rule("trip", PatternType.REGEX), tx);
        assertThat(matcher.cachedPatternCount()).isEqualTo(2);

        matcher.evict("uber");
        matcher.evict(null);

        assertThat(matcher.cachedPatternCount()).isEqualTo(1);
        assertThat(matcher.matches(rule("uber", PatternType.REGEX), tx)).isTrue();
    }

    private Transaction transaction(String description, String vendor) {
        return Transaction.uncategorized(UUID.randomUUID(), userId, null, description, vendor, new BigDecimal("-4.50"), Instant.now());
    }

    private CategorizationRule rule(String pattern, PatternType type) {
        Instant now = Instant.now();
        return new CategorizationRule(UUID.randomUUID(), userId, pattern, type, "Food", null, 1, true, now, now);
    }
}
