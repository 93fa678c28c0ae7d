package com.example.polystoresync.exception;

import java.util.List;

/**
 * Best-effort rollback left partial state behind; the listed stores still hold writes
 * that could not be undone and need operator attention.
 */
public class RollbackException extends SyncException {

    private final List<String> unrecoveredStores;
    private final String transactionId;

    public RollbackException(String message, List<String> unrecoveredStores, String transactionId, Throwable cause) {
        super(message, cause);
        this.unrecoveredStores = unrecoveredStores == null ? List.of() : List.copyOf(unrecoveredStores);
        this.transactionId = transactionId;
    }

    public List<String> getUnrecoveredStores() {
        return unrecoveredStores;
    }

    public String getTransactionId() {
        return transactionId;
    }

    @Override
    public String getKind() {
        return "rollback_failure";
    }
}
