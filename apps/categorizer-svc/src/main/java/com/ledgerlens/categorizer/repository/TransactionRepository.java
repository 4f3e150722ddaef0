package com.ledgerlens.categorizer.repository;

import com.ledgerlens.categorizer.model.Transaction;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface TransactionRepository {

    Transaction save(Transaction transaction);

    List<Transaction> saveAll(List<Transaction> transactions);

    Optional<Transaction> findByIdAndUserId(UUID transactionId, UUID userId);

    /**
     * The user's transactions among {@code transactionIds}; ids of other users are ignored.
     */
    List<Transaction> findByIdsAndUserId(List<UUID> transactionIds, UUID userId);

    /**
     * Uncategorized transactions of the user, optionally restricted to one import batch.
     */
    List<Transaction> findUncategorized(UUID userId, Optional<String> importBatch);

    List<Transaction> findByUserId(UUID userId);

    List<Transaction> findCategorized(UUID userId);
}
