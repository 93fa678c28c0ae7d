package com.example.polystoresync.model;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A single store call inside a {@link SyncTransaction}.
 * Owned by exactly one transaction; status moves pending, in_progress, then committed or failed.
 */
@Getter
public class StoreOperation {

    private final String operationId;
    private final OperationKind kind;
    private final StoreRole role;
    private final String documentId;
    private final DocumentRecord document;

    private volatile TransactionStatus status = TransactionStatus.PENDING;
    private volatile String error;
    private volatile Instant startedAt;
    private volatile Instant completedAt;
    private volatile Double executionTimeMs;

    // Journal entry: the document as it was before this write, null when it did not exist
    private volatile DocumentRecord rollbackImage;
    private volatile DocumentRecord retrieved;

    // Set when the call missed its deadline: the store may still apply the write
    private volatile boolean outcomeUnknown;
    private volatile CompletableFuture<Void> lateCall;

    public StoreOperation(String operationId, OperationKind kind, StoreRole role,
                          String documentId, DocumentRecord document) {
        this.operationId = Objects.requireNonNull(operationId, "operationId");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.role = Objects.requireNonNull(role, "role");
        this.documentId = Objects.requireNonNull(documentId, "documentId");
        if ((kind == OperationKind.CREATE || kind == OperationKind.UPDATE) && document == null) {
            throw new IllegalArgumentException(kind.getValue() + " operation requires a document");
        }
        this.document = document;
    }

    public void markStarted() {
        this.startedAt = Instant.now();
        this.status = TransactionStatus.IN_PROGRESS;
    }

    public void markCompleted(boolean success, String errorMessage) {
        this.completedAt = Instant.now();
        if (success) {
            this.status = TransactionStatus.COMMITTED;
        } else {
            this.status = TransactionStatus.FAILED;
            this.error = errorMessage;
        }
        if (startedAt != null) {
            this.executionTimeMs = Duration.between(startedAt, completedAt).toNanos() / 1_000_000.0;
        }
    }

    /**
     * Fail the operation after its call timed out. The write may still land, so rollback
     * treats it like a committed write once {@code lateCall} completes.
     */
    public void markTimedOut(String errorMessage, CompletableFuture<Void> lateCall) {
        markCompleted(false, errorMessage);
        this.outcomeUnknown = true;
        this.lateCall = lateCall;
    }

    void markAbandoned() {
        if (!status.isTerminal()) {
            markCompleted(false, "abandoned before execution");
        }
    }

    public void journal(DocumentRecord previous) {
        this.rollbackImage = previous;
    }

    public void setRetrieved(DocumentRecord retrieved) {
        this.retrieved = retrieved;
    }

    public boolean isCommitted() {
        return status == TransactionStatus.COMMITTED;
    }

    /**
     * Whether rollback has to undo this operation: it committed, or it timed out and may have.
     */
    public boolean needsUndo() {
        return isCommitted() || (outcomeUnknown && kind.isWrite());
    }

    public boolean isFailed() {
        return status == TransactionStatus.FAILED;
    }

    public boolean isCritical() {
        return role.isCritical();
    }
}
