package com.example.polystoresync.model;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * One logical document write, composed of ordered store operations.
 * Lives in the coordinator's registry for the duration of the outer call and is never persisted.
 */
@Getter
public class SyncTransaction {

    private final String transactionId;
    private final List<StoreOperation> operations = new ArrayList<>();

    private volatile TransactionStatus status = TransactionStatus.PENDING;
    private volatile Instant startedAt;
    private volatile Instant completedAt;
    private volatile Double totalExecutionTimeMs;
    private volatile boolean rollbackAttempted;
    private volatile boolean rollbackSucceeded;

    public SyncTransaction(String transactionId) {
        this.transactionId = Objects.requireNonNull(transactionId, "transactionId");
    }

    public static SyncTransaction create() {
        return new SyncTransaction(UUID.randomUUID().toString());
    }

    public StoreOperation addOperation(OperationKind kind, StoreRole role, String documentId, DocumentRecord document) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Transaction " + transactionId + " is already " + status.getValue());
        }
        StoreOperation operation = new StoreOperation(
                transactionId + "_" + role.getStoreName() + "_" + operations.size(),
                kind, role, documentId, document);
        operations.add(operation);
        return operation;
    }

    public List<StoreOperation> getOperations() {
        return Collections.unmodifiableList(operations);
    }

    public List<StoreOperation> operationsFor(StoreRole role) {
        return operations.stream().filter(op -> op.getRole() == role).collect(Collectors.toList());
    }

    public List<StoreOperation> failedOperations() {
        return operations.stream().filter(StoreOperation::isFailed).collect(Collectors.toList());
    }

    public List<StoreOperation> committedOperations() {
        return operations.stream().filter(StoreOperation::isCommitted).collect(Collectors.toList());
    }

    public List<StoreRole> failedRoles(StoreRole.Priority priority) {
        return failedOperations().stream()
                .map(StoreOperation::getRole)
                .filter(role -> role.getPriority() == priority)
                .distinct()
                .collect(Collectors.toList());
    }

    public void markStarted() {
        this.startedAt = Instant.now();
        this.status = TransactionStatus.IN_PROGRESS;
    }

    public void markCompleted(boolean success) {
        this.completedAt = Instant.now();
        this.status = success ? TransactionStatus.COMMITTED : TransactionStatus.FAILED;
        if (startedAt != null) {
            this.totalExecutionTimeMs = Duration.between(startedAt, completedAt).toNanos() / 1_000_000.0;
        }
    }

    public void markRollbackAttempted(boolean successful) {
        this.rollbackAttempted = true;
        this.rollbackSucceeded = successful;
        if (completedAt == null) {
            this.completedAt = Instant.now();
        }
        this.status = successful ? TransactionStatus.ROLLED_BACK : TransactionStatus.FAILED;
    }

    /**
     * Fails every operation that has not run yet, leaving the transaction status alone.
     */
    public void abandonPending() {
        operations.forEach(StoreOperation::markAbandoned);
    }

    /**
     * Gives up on every operation that has not run yet.
     */
    public void abandon() {
        abandonPending();
        this.completedAt = Instant.now();
        this.status = TransactionStatus.ROLLED_BACK;
    }
}
