package com.example.polystoresync.service;

import com.example.polystoresync.exception.PerformanceSlaExceededException;
import com.example.polystoresync.exception.SyncException;
import com.example.polystoresync.model.DocumentRecord;
import com.example.polystoresync.model.OperationKind;
import com.example.polystoresync.model.StoreOperation;
import com.example.polystoresync.model.StoreRole;
import com.example.polystoresync.model.SyncResult;
import com.example.polystoresync.model.SyncTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Caller-driven transaction. Operations run in the order they were queued when {@link #commit()}
 * is called: critical stores directly, optional stores through their circuit breakers.
 *
 * <pre>{@code
 * try (TransactionScope scope = coordinator.begin()) {
 *     scope.create(StoreRole.RELATIONAL, doc).create(StoreRole.VECTOR, doc);
 *     SyncResult result = scope.commit();
 * }
 * }</pre>
 */
public class TransactionScope implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(TransactionScope.class);

    private final SyncCoordinator coordinator;
    private final SyncTransaction transaction;
    private final long startNanos;
    private boolean committed;
    private boolean closed;

    TransactionScope(SyncCoordinator coordinator) {
        this.coordinator = coordinator;
        this.transaction = SyncTransaction.create();
        this.startNanos = System.nanoTime();
        coordinator.registerTransaction(transaction);
        transaction.markStarted();
        logger.debug("Opened transaction scope {}", transaction.getTransactionId());
    }

    public TransactionScope create(StoreRole role, DocumentRecord document) {
        return queue(OperationKind.CREATE, role, document.getId(), document);
    }

    public TransactionScope update(StoreRole role, DocumentRecord document) {
        return queue(OperationKind.UPDATE, role, document.getId(), document);
    }

    public TransactionScope delete(StoreRole role, String docId) {
        return queue(OperationKind.DELETE, role, docId, null);
    }

    public TransactionScope retrieve(StoreRole role, String docId) {
        return queue(OperationKind.RETRIEVE, role, docId, null);
    }

    private TransactionScope queue(OperationKind kind, StoreRole role, String docId, DocumentRecord document) {
        ensureOpen();
        transaction.addOperation(kind, role, docId, document);
        return this;
    }

    /**
     * Execute the queued operations.
     *
     * @return the outcome, healthy or degraded
     * @throws com.example.polystoresync.exception.AtomicTransactionException when a critical operation
     *         failed; executed operations were rolled back
     * @throws com.example.polystoresync.exception.RollbackException when that rollback was incomplete
     */
    public SyncResult commit() {
        ensureOpen();
        committed = true;
        List<PerformanceSlaExceededException> slaViolations = new CopyOnWriteArrayList<>();
        try {
            journal();
            for (StoreOperation operation : transaction.getOperations()) {
                boolean ok = operation.isCritical()
                        ? coordinator.executeOperation(operation)
                        : coordinator.executeOptionalOperation(operation, slaViolations);
                if (!ok && operation.isCritical()) {
                    SyncException failure = coordinator.failTransaction(transaction,
                            List.of(operation.getRole()),
                            "Critical database failure in " + operation.getRole().getStoreName()
                                    + " for transaction " + transaction.getTransactionId());
                    coordinator.recordOutcome(false, SlaPolicy.elapsedMs(startNanos));
                    throw failure;
                }
            }
            transaction.markCompleted(true);
            String docId = transaction.getOperations().isEmpty()
                    ? null : transaction.getOperations().get(0).getDocumentId();
            return coordinator.successResult(transaction, docId, startNanos, slaViolations, false);
        } finally {
            closed = true;
            coordinator.deregisterTransaction(transaction);
        }
    }

    // Reads the relational copy of every written document once, before anything runs
    private void journal() {
        Map<String, Optional<DocumentRecord>> images = new HashMap<>();
        for (StoreOperation operation : transaction.getOperations()) {
            if (!operation.getKind().isWrite()) {
                continue;
            }
            String docId = operation.getDocumentId();
            if (!images.containsKey(docId)) {
                try {
                    images.put(docId, coordinator.readRelationalImage(docId));
                } catch (RuntimeException e) {
                    logger.error("Pre-write journal read failed for {}: {}", docId, e.getMessage());
                    SyncException failure = coordinator.failTransaction(transaction, List.of(StoreRole.RELATIONAL),
                            "Critical database failure in relational for transaction "
                                    + transaction.getTransactionId() + ": journal read failed");
                    coordinator.recordOutcome(false, SlaPolicy.elapsedMs(startNanos));
                    throw failure;
                }
            }
            operation.journal(images.get(docId).orElse(null));
        }
    }

    public String getTransactionId() {
        return transaction.getTransactionId();
    }

    public SyncTransaction getTransaction() {
        return transaction;
    }

    /**
     * Documents read by retrieve operations against the given store, in queue order.
     */
    public Optional<DocumentRecord> retrieved(StoreRole role) {
        return transaction.operationsFor(role).stream()
                .filter(op -> op.getKind() == OperationKind.RETRIEVE && op.getRetrieved() != null)
                .map(StoreOperation::getRetrieved)
                .findFirst();
    }

    private void ensureOpen() {
        if (committed || closed) {
            throw new IllegalStateException("Transaction scope " + transaction.getTransactionId() + " is no longer open");
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!committed) {
            transaction.abandon();
            coordinator.deregisterTransaction(transaction);
            logger.debug("Transaction scope {} closed without commit, queued operations abandoned",
                    transaction.getTransactionId());
        }
    }
}
