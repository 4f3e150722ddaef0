package com.ledgerlens.categorizer.repository;

import com.ledgerlens.categorizer.entity.TransactionEntity;
import com.ledgerlens.categorizer.model.CategorizationMethod;
import com.ledgerlens.categorizer.model.Transaction;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

@Repository
@Primary
public class PostgreSQLTransactionRepository implements TransactionRepository {

    private static final Logger log = LoggerFactory.getLogger(PostgreSQLTransactionRepository.class);

    private final JpaTransactionRepository jpaTransactionRepository;

    public PostgreSQLTransactionRepository(JpaTransactionRepository jpaTransactionRepository) {
        this.jpaTransactionRepository = jpaTransactionRepository;
    }

    @Override
    public Transaction save(Transaction transaction) {
        TransactionEntity entity = jpaTransactionRepository.findById(transaction.id())
                .map(existing -> apply(existing, transaction, Instant.now()))
                .orElseGet(() -> toEntity(transaction, Instant.now()));
        return toModel(jpaTransactionRepository.save(entity));
    }

    @Override
    public List<Transaction> saveAll(List<Transaction> transactions) {
        if (transactions.isEmpty()) {
            return List.of();
        }
        Instant now = Instant.now();
        List<UUID> ids = transactions.stream().map(Transaction::id).toList();
        // Load managed rows in one round trip, then merge the new state into them
        Map<UUID, TransactionEntity> existing = jpaTransactionRepository.findAllById(ids)
                .stream()
                .collect(Collectors.toMap(TransactionEntity::getId, Function.identity()));
        List<TransactionEntity> entities = transactions.stream()
                .map(tx -> {
                    TransactionEntity current = existing.get(tx.id());
                    return current != null ? apply(current, tx, now) : toEntity(tx, now);
                })
                .toList();
        return jpaTransactionRepository.saveAll(entities).stream()
                .map(this::toModel)
                .toList();
    }

    @Override
    public Optional<Transaction> findByIdAndUserId(UUID transactionId, UUID userId) {
        return jpaTransactionRepository.findByIdAndUserId(transactionId, userId)
                .map(this::toModel);
    }

    @Override
    public List<Transaction> findByIdsAndUserId(List<UUID> transactionIds, UUID userId) {
        if (transactionIds.isEmpty()) {
            return List.of();
        }
        return convertToModels(jpaTransactionRepository.findByIdsAndUserId(transactionIds, userId));
    }

    @Override
    public List<Transaction> findUncategorized(UUID userId, Optional<String> importBatch) {
        List<TransactionEntity> entities = importBatch
                .map(batch -> jpaTransactionRepository.findUncategorizedInBatch(userId, batch))
                .orElseGet(() -> jpaTransactionRepository.findUncategorized(userId));
        return convertToModels(entities);
    }

    @Override
    public List<Transaction> findByUserId(UUID userId) {
        return convertToModels(jpaTransactionRepository.findByUserId(userId));
    }

    @Override
    public List<Transaction> findCategorized(UUID userId) {
        return convertToModels(jpaTransactionRepository.findCategorized(userId));
    }

    private List<Transaction> convertToModels(List<TransactionEntity> entities) {
        if (entities.isEmpty()) {
            return List.of();
        }
        return entities.stream()
                .map(this::toModel)
                .collect(Collectors.toList());
    }

    private Transaction toModel(TransactionEntity entity) {
        // Rows written by older importers may carry a category without the flag; trust the category
        boolean categorized = entity.getCategory() != null;
        if (categorized != entity.isCategorized()) {
            log.warn("Transaction {} has is_categorized={} but category={}; using category presence",
                    entity.getId(), entity.isCategorized(), entity.getCategory());
        }
        return new Transaction(
                entity.getId(),
                entity.getUserId(),
                Optional.ofNullable(entity.getImportBatch()),
                entity.getDescription(),
                Optional.ofNullable(entity.getVendor()),
                entity.getAmount(),
                entity.getOccurredAt(),
                entity.getCategory(),
                entity.getSubcategory(),
                categorized,
                entity.getConfidenceScore(),
                parseMethod(entity.getCategorizationMethod())
        );
    }

    private TransactionEntity toEntity(Transaction model, Instant now) {
        return new TransactionEntity(
                model.id(),
                model.userId(),
                model.importBatch().orElse(null),
                model.description(),
                model.vendor().orElse(null),
                model.amount(),
                model.occurredAt(),
                model.category(),
                model.subcategory(),
                model.categorized(),
                model.confidenceScore(),
                model.categorizationMethod() != null ? model.categorizationMethod().name() : null,
                now,
                null
        );
    }

    private TransactionEntity apply(TransactionEntity entity, Transaction model, Instant now) {
        if (!entity.getUserId().equals(model.userId())) {
            throw new IllegalArgumentException("Transaction " + model.id() + " belongs to another user");
        }
        entity.setImportBatch(model.importBatch().orElse(null));
        entity.setDescription(model.description());
        entity.setVendor(model.vendor().orElse(null));
        entity.setAmount(model.amount());
        entity.setOccurredAt(model.occurredAt());
        entity.setCategory(model.category());
        entity.setSubcategory(model.subcategory());
        entity.setCategorized(model.categorized());
        entity.setConfidenceScore(model.confidenceScore());
        entity.setCategorizationMethod(model.categorizationMethod() != null ? model.categorizationMethod().name() : null);
        entity.setUpdatedAt(now);
        return entity;
    }

    private CategorizationMethod parseMethod(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return CategorizationMethod.valueOf(value);
        } catch (IllegalArgumentException ex) {
            log.warn("Unknown categorization method '{}' in storage", value);
            return null;
        }
    }
}
