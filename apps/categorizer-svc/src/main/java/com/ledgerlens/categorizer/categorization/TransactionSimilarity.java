package com.ledgerlens.categorizer.categorization;

import com.ledgerlens.categorizer.model.Transaction;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Decides whether an uncategorized transaction looks like one the user just categorized by hand.
 * Any one of three signals is enough: same vendor, at least two shared words among the leading
 * words of both descriptions, or one shared key term anywhere in the descriptions.
 */
@Component
public class TransactionSimilarity {

    public static final int LEADING_WORD_WINDOW = 3;
    public static final int LEADING_WORD_MATCH_THRESHOLD = 2;
    public static final int KEY_TERM_MIN_LENGTH_EXCLUSIVE = 3;
    public static final int KEY_TERM_MATCH_THRESHOLD = 1;

    public boolean isSimilar(Transaction candidate, Transaction reference) {
        if (sameVendor(candidate, reference)) {
            return true;
        }
        List<String> candidateWords = words(candidate.description());
        List<String> referenceWords = words(reference.description());

        if (overlap(leadingWords(candidateWords), leadingWords(referenceWords)) >= LEADING_WORD_MATCH_THRESHOLD) {
            return true;
        }
        return overlap(keyTerms(candidateWords), keyTerms(referenceWords)) >= KEY_TERM_MATCH_THRESHOLD;
    }

    private boolean sameVendor(Transaction candidate, Transaction reference) {
        return candidate.vendorName()
                .flatMap(vendor -> reference.vendorName().map(vendor::equalsIgnoreCase))
                .orElse(false);
    }

    static List<String> words(String description) {
        String trimmed = description.trim();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(trimmed.toLowerCase(Locale.ROOT).split("\\s+")).toList();
    }

    private static Set<String> leadingWords(List<String> words) {
        return new HashSet<>(words.subList(0, Math.min(LEADING_WORD_WINDOW, words.size())));
    }

    private static Set<String> keyTerms(List<String> words) {
        return words.stream()
                .filter(word -> word.length() > KEY_TERM_MIN_LENGTH_EXCLUSIVE)
                .collect(Collectors.toSet());
    }

    private static int overlap(Set<String> left, Set<String> right) {
        Set<String> common = new HashSet<>(left);
        common.retainAll(right);
        return common.size();
    }
}
