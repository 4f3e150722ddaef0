package com.ledgerlens.categorizer.repository;

import com.ledgerlens.categorizer.entity.CategorizationRuleEntity;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaCategorizationRuleRepository extends JpaRepository<CategorizationRuleEntity, UUID> {

    @Query("SELECT r FROM CategorizationRuleEntity r WHERE r.userId = :userId AND r.active = true ORDER BY r.priority DESC, r.createdAt ASC")
    List<CategorizationRuleEntity> findActiveByUserId(@Param("userId") UUID userId);

    @Query("SELECT r FROM CategorizationRuleEntity r WHERE r.userId = :userId ORDER BY r.priority DESC, r.createdAt ASC")
    List<CategorizationRuleEntity> findByUserId(@Param("userId") UUID userId);

    Optional<CategorizationRuleEntity> findByIdAndUserId(UUID id, UUID userId);

    Optional<CategorizationRuleEntity> findFirstByUserIdAndPatternAndPatternTypeOrderByCreatedAtAsc(UUID userId,
                                                                                                    String pattern,
                                                                                                    String patternType);
}
