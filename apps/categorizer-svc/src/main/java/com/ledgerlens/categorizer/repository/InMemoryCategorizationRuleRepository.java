package com.ledgerlens.categorizer.repository;

import com.ledgerlens.categorizer.model.CategorizationRule;
import com.ledgerlens.categorizer.model.PatternType;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryCategorizationRuleRepository implements CategorizationRuleRepository {

    private final Map<UUID, CategorizationRule> storage = new ConcurrentHashMap<>();
    private final Map<UUID, Long> insertionOrder = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public List<CategorizationRule> findActiveByUserId(UUID userId) {
        return findByUserId(userId).stream()
                .filter(CategorizationRule::active)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public List<CategorizationRule> findByUserId(UUID userId) {
        return storage.values().stream()
                .filter(rule -> rule.userId().equals(userId))
                .sorted(priorityOrder())
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public Optional<CategorizationRule> findByIdAndUserId(UUID ruleId, UUID userId) {
        return Optional.ofNullable(storage.get(ruleId))
                .filter(rule -> rule.userId().equals(userId));
    }

    @Override
    public Optional<CategorizationRule> findByPatternKey(UUID userId, String pattern, PatternType patternType) {
        return storage.values().stream()
                .filter(rule -> rule.userId().equals(userId))
                .filter(rule -> rule.pattern().equals(pattern) && rule.patternType() == patternType)
                .min(Comparator.comparingLong(this::insertionIndex));
    }

    @Override
    public CategorizationRule save(CategorizationRule rule) {
        insertionOrder.computeIfAbsent(rule.id(), id -> sequence.incrementAndGet());
        storage.put(rule.id(), rule);
        return rule;
    }

    @Override
    public void delete(CategorizationRule rule) {
        storage.remove(rule.id());
        insertionOrder.remove(rule.id());
    }

    private Comparator<CategorizationRule> priorityOrder() {
        return Comparator.comparingInt(CategorizationRule::priority).reversed()
                .thenComparingLong(this::insertionIndex);
    }

    private long insertionIndex(CategorizationRule rule) {
        return insertionOrder.getOrDefault(rule.id(), Long.MAX_VALUE);
    }
}
