package com.example.polystoresync.model;

/**
 * Lifecycle of transactions and their operations. Operations never reach ROLLED_BACK.
 */
public enum TransactionStatus {
    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    COMMITTED("committed"),
    FAILED("failed"),
    ROLLED_BACK("rolled_back");

    private final String value;

    TransactionStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMMITTED || this == FAILED || this == ROLLED_BACK;
    }
}
