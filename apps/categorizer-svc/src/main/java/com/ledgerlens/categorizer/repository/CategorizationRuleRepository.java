package com.ledgerlens.categorizer.repository;

import com.ledgerlens.categorizer.model.CategorizationRule;
import com.ledgerlens.categorizer.model.PatternType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CategorizationRuleRepository {

    /**
     * Active rules of the user, highest priority first. Equal priorities come back oldest first.
     */
    List<CategorizationRule> findActiveByUserId(UUID userId);

    List<CategorizationRule> findByUserId(UUID userId);

    Optional<CategorizationRule> findByIdAndUserId(UUID ruleId, UUID userId);

    /**
     * First rule (oldest) stored under the exact pattern key. Pattern comparison is case-sensitive.
     */
    Optional<CategorizationRule> findByPatternKey(UUID userId, String pattern, PatternType patternType);

    CategorizationRule save(CategorizationRule rule);

    void delete(CategorizationRule rule);
}
