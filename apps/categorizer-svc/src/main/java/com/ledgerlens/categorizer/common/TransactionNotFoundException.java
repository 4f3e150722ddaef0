package com.ledgerlens.categorizer.common;

import java.util.UUID;

public class TransactionNotFoundException extends ResourceNotFoundException {

    public TransactionNotFoundException(UUID transactionId) {
        super("Transaction not found: " + transactionId);
    }
}
