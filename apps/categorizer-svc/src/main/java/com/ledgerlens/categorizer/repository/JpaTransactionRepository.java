package com.ledgerlens.categorizer.repository;

import com.ledgerlens.categorizer.entity.TransactionEntity;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaTransactionRepository extends JpaRepository<TransactionEntity, UUID> {

    Optional<TransactionEntity> findByIdAndUserId(UUID id, UUID userId);

    @Query("SELECT t FROM TransactionEntity t WHERE t.userId = :userId AND t.id IN :ids ORDER BY t.occurredAt ASC, t.createdAt ASC")
    List<TransactionEntity> findByIdsAndUserId(@Param("ids") List<UUID> ids, @Param("userId") UUID userId);

    @Query("SELECT t FROM TransactionEntity t WHERE t.userId = :userId AND t.categorized = false AND t.category IS NULL ORDER BY t.occurredAt ASC, t.createdAt ASC")
    List<TransactionEntity> findUncategorized(@Param("userId") UUID userId);

    @Query("SELECT t FROM TransactionEntity t WHERE t.userId = :userId AND t.categorized = false AND t.category IS NULL AND t.importBatch = :importBatch ORDER BY t.occurredAt ASC, t.createdAt ASC")
    List<TransactionEntity> findUncategorizedInBatch(@Param("userId") UUID userId,
                                                     @Param("importBatch") String importBatch);

    @Query("SELECT t FROM TransactionEntity t WHERE t.userId = :userId ORDER BY t.occurredAt DESC")
    List<TransactionEntity> findByUserId(@Param("userId") UUID userId);

    @Query("SELECT t FROM TransactionEntity t WHERE t.userId = :userId AND t.category IS NOT NULL ORDER BY t.occurredAt DESC")
    List<TransactionEntity> findCategorized(@Param("userId") UUID userId);
}
