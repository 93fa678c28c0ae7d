package com.example.polystoresync.exception;

import java.util.List;

/**
 * A critical store failed, so the whole transaction failed.
 */
public class AtomicTransactionException extends SyncException {

    private final List<String> failedStores;
    private final String transactionId;

    public AtomicTransactionException(String message, List<String> failedStores, String transactionId) {
        super(message);
        this.failedStores = failedStores == null ? List.of() : List.copyOf(failedStores);
        this.transactionId = transactionId;
    }

    public List<String> getFailedStores() {
        return failedStores;
    }

    public String getTransactionId() {
        return transactionId;
    }

    @Override
    public String getKind() {
        return "atomic_transaction_failure";
    }
}
