package com.ledgerlens.categorizer.repository;

import com.ledgerlens.categorizer.model.Transaction;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryTransactionRepository implements TransactionRepository {

    private final Map<UUID, Transaction> storage = new ConcurrentHashMap<>();

    @Override
    public Transaction save(Transaction transaction) {
        storage.put(transaction.id(), transaction);
        return transaction;
    }

    @Override
    public List<Transaction> saveAll(List<Transaction> transactions) {
        transactions.forEach(this::save);
        return List.copyOf(transactions);
    }

    @Override
    public Optional<Transaction> findByIdAndUserId(UUID transactionId, UUID userId) {
        return Optional.ofNullable(storage.get(transactionId))
                .filter(tx -> tx.userId().equals(userId));
    }

    @Override
    public List<Transaction> findByIdsAndUserId(List<UUID> transactionIds, UUID userId) {
        return transactionIds.stream()
                .distinct()
                .map(storage::get)
                .filter(tx -> tx != null && tx.userId().equals(userId))
                .sorted(Comparator.comparing(Transaction::occurredAt))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public List<Transaction> findUncategorized(UUID userId, Optional<String> importBatch) {
        return storage.values().stream()
                .filter(tx -> tx.userId().equals(userId))
                .filter(tx -> !tx.categorized())
                .filter(tx -> importBatch.isEmpty() || importBatch.equals(tx.importBatch()))
                .sorted(Comparator.comparing(Transaction::occurredAt))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public List<Transaction> findByUserId(UUID userId) {
        return storage.values().stream()
                .filter(tx -> tx.userId().equals(userId))
                .sorted(Comparator.comparing(Transaction::occurredAt).reversed())
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public List<Transaction> findCategorized(UUID userId) {
        return findByUserId(userId).stream()
                .filter(tx -> tx.category() != null)
                .collect(Collectors.toCollection(ArrayList::new));
    }
}
