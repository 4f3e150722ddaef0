package com.ledgerlens.categorizer.repository;

import com.ledgerlens.categorizer.entity.CategorizationRuleEntity;
import com.ledgerlens.categorizer.model.CategorizationRule;
import com.ledgerlens.categorizer.model.PatternType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

@Repository
@Primary
public class PostgreSQLCategorizationRuleRepository implements CategorizationRuleRepository {

    private static final Logger log = LoggerFactory.getLogger(PostgreSQLCategorizationRuleRepository.class);

    private final JpaCategorizationRuleRepository jpaRuleRepository;

    public PostgreSQLCategorizationRuleRepository(JpaCategorizationRuleRepository jpaRuleRepository) {
        this.jpaRuleRepository = jpaRuleRepository;
    }

    @Override
    public List<CategorizationRule> findActiveByUserId(UUID userId) {
        return convertToModels(jpaRuleRepository.findActiveByUserId(userId));
    }

    @Override
    public List<CategorizationRule> findByUserId(UUID userId) {
        return convertToModels(jpaRuleRepository.findByUserId(userId));
    }

    @Override
    public Optional<CategorizationRule> findByIdAndUserId(UUID ruleId, UUID userId) {
        return jpaRuleRepository.findByIdAndUserId(ruleId, userId)
                .flatMap(this::toModel);
    }

    @Override
    public Optional<CategorizationRule> findByPatternKey(UUID userId, String pattern, PatternType patternType) {
        return jpaRuleRepository.findFirstByUserIdAndPatternAndPatternTypeOrderByCreatedAtAsc(userId, pattern, patternType.value())
                .flatMap(this::toModel);
    }

    @Override
    public CategorizationRule save(CategorizationRule rule) {
        CategorizationRuleEntity saved = jpaRuleRepository.save(toEntity(rule));
        return toModel(saved)
                .orElseThrow(() -> new IllegalStateException("Saved rule " + rule.id() + " could not be read back"));
    }

    @Override
    public void delete(CategorizationRule rule) {
        jpaRuleRepository.deleteById(rule.id());
    }

    private List<CategorizationRule> convertToModels(List<CategorizationRuleEntity> entities) {
        return entities.stream()
                .map(this::toModel)
                .flatMap(Optional::stream)
                .toList();
    }

    private Optional<CategorizationRule> toModel(CategorizationRuleEntity entity) {
        Optional<PatternType> patternType = PatternType.fromStorage(entity.getPatternType());
        if (patternType.isEmpty()) {
            log.warn("Ignoring rule {} with unsupported pattern type '{}'", entity.getId(), entity.getPatternType());
            return Optional.empty();
        }
        return Optional.of(new CategorizationRule(
                entity.getId(),
                entity.getUserId(),
                entity.getPattern(),
                patternType.get(),
                entity.getCategory(),
                entity.getSubcategory(),
                entity.getPriority(),
                entity.isActive(),
                entity.getCreatedAt(),
                entity.getUpdatedAt()
        ));
    }

    private CategorizationRuleEntity toEntity(CategorizationRule model) {
        return new CategorizationRuleEntity(
                model.id(),
                model.userId(),
                model.pattern(),
                model.patternType().value(),
                model.category(),
                model.subcategory(),
                model.priority(),
                model.active(),
                model.createdAt(),
                model.updatedAt()
        );
    }
}
