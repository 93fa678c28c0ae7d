package com.example.polystoresync.service;

import com.example.polystoresync.breaker.CircuitBreakerManager;
import com.example.polystoresync.breaker.CircuitBreakerState;
import com.example.polystoresync.exception.AtomicTransactionException;
import com.example.polystoresync.exception.CircuitBreakerOpenException;
import com.example.polystoresync.exception.ConsistencyValidationException;
import com.example.polystoresync.exception.PerformanceSlaExceededException;
import com.example.polystoresync.exception.RollbackException;
import com.example.polystoresync.exception.StoreCallTimeoutException;
import com.example.polystoresync.exception.SyncException;
import com.example.polystoresync.model.ConsistencyReport;
import com.example.polystoresync.model.DocumentRecord;
import com.example.polystoresync.model.OperationKind;
import com.example.polystoresync.model.StoreHealth;
import com.example.polystoresync.model.StoreOperation;
import com.example.polystoresync.model.StoreRole;
import com.example.polystoresync.model.SyncResult;
import com.example.polystoresync.model.SyncTransaction;
import com.example.polystoresync.model.SystemStatus;
import com.example.polystoresync.store.CriticalStoreAdapter;
import com.example.polystoresync.store.StoreAdapter;
import com.example.polystoresync.store.StoreTopology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.stream.Collectors;

/**
 * Writes one logical document to all four stores.
 *
 * <ol>
 *   <li>Critical phase: relational, then vector, sequentially and without a breaker.
 *       Any failure aborts the transaction and rolls back what was committed.</li>
 *   <li>Optional phase: graph and cache concurrently, each through its circuit breaker.
 *       A failure here degrades the result instead of failing it.</li>
 * </ol>
 *
 * Every store call runs under the {@link StoreCallExecutor} deadline. Before any write the
 * relational copy of the document is read and journaled so rollback can restore it.
 */
public class SyncCoordinator implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SyncCoordinator.class);

    private final StoreTopology topology;
    private final CircuitBreakerManager circuitBreakers;
    private final TransactionRegistry registry;
    private final StoreCallExecutor storeCalls;
    private final ConsistencyValidator validator;
    private final SlaPolicy slaPolicy;
    private final ExecutorService dispatchExecutor;

    private final AtomicLong totalTransactions = new AtomicLong();
    private final AtomicLong committedTransactions = new AtomicLong();
    private final AtomicLong failedTransactions = new AtomicLong();
    private final AtomicLong rolledBackTransactions = new AtomicLong();
    private final DoubleAdder totalTransactionTimeMs = new DoubleAdder();

    public SyncCoordinator(StoreTopology topology,
                           CircuitBreakerManager circuitBreakers,
                           TransactionRegistry registry,
                           StoreCallExecutor storeCalls,
                           ConsistencyValidator validator,
                           SlaPolicy slaPolicy,
                           ExecutorService dispatchExecutor) {
        this.topology = Objects.requireNonNull(topology, "topology");
        this.circuitBreakers = Objects.requireNonNull(circuitBreakers, "circuitBreakers");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.storeCalls = Objects.requireNonNull(storeCalls, "storeCalls");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.slaPolicy = Objects.requireNonNull(slaPolicy, "slaPolicy");
        this.dispatchExecutor = Objects.requireNonNull(dispatchExecutor, "dispatchExecutor");
    }

    /**
     * Create or replace a document in every store.
     *
     * @throws PerformanceSlaExceededException when the call exceeded the single operation limit;
     *                                         the result is carried by the exception
     */
    public SyncResult storeDocument(DocumentRecord document) {
        Objects.requireNonNull(document, "document");
        SyncResult result = execute(OperationKind.CREATE, document.getId(), document, "store_document");
        return enforceSingleOperation(result, "store_document");
    }

    /**
     * Update an existing document. The original creation time is kept. Fails without touching
     * any store when the relational store does not hold the document.
     */
    public SyncResult updateDocument(DocumentRecord document) {
        Objects.requireNonNull(document, "document");
        SyncResult result = execute(OperationKind.UPDATE, document.getId(), document, "update_document");
        return enforceSingleOperation(result, "update_document");
    }

    public SyncResult deleteDocument(String docId) {
        requireId(docId);
        SyncResult result = execute(OperationKind.DELETE, docId, null, "delete_document");
        return enforceSingleOperation(result, "delete_document");
    }

    /**
     * Store documents one after another, stopping at the first failed write. Documents already
     * written stay written. Per-document overruns are recorded on each result.
     *
     * @throws PerformanceSlaExceededException when the whole batch exceeded its limit
     */
    public List<SyncResult> batchStore(List<DocumentRecord> documents) {
        long startNanos = System.nanoTime();
        List<SyncResult> results = new ArrayList<>();
        for (DocumentRecord document : documents) {
            SyncResult result = recordSingleOperation(
                    execute(OperationKind.CREATE, document.getId(), document, "store_document"), "store_document");
            results.add(result);
            if (!result.isSuccess()) {
                logger.warn("Batch stopped at document {} after {} of {} documents",
                        document.getId(), results.size(), documents.size());
                break;
            }
        }
        enforceSla(PerformanceSla.BATCH_OPERATION, "batch_store", SlaPolicy.elapsedMs(startNanos),
                Collections.unmodifiableList(results));
        return results;
    }

    /**
     * Read a document from the relational store, falling back to the vector store's copy when
     * the relational store cannot be reached.
     */
    public Optional<DocumentRecord> retrieveDocument(String docId) {
        requireId(docId);
        long startNanos = System.nanoTime();
        Optional<DocumentRecord> document = retrieveWithFallback(docId);
        enforceSla(PerformanceSla.QUERY_OPERATION, "retrieve_document", SlaPolicy.elapsedMs(startNanos),
                List.of(document));
        return document;
    }

    public ConsistencyReport validateConsistency(String docId) {
        requireId(docId);
        long startNanos = System.nanoTime();
        ConsistencyReport report = validator.validate(docId);
        enforceSla(PerformanceSla.QUERY_OPERATION, "validate_consistency", SlaPolicy.elapsedMs(startNanos),
                List.of(report));
        return report;
    }

    /**
     * Open a scoped transaction. Queue operations on it, then commit; closing without a commit
     * abandons whatever was queued.
     */
    public TransactionScope begin() {
        return new TransactionScope(this);
    }

    /**
     * Tier-aware health report: per-store health, breaker snapshots, active transactions and
     * coordinator metrics.
     */
    public Map<String, Object> healthStatus() {
        Map<String, Object> perStore = new LinkedHashMap<>();
        int criticalFailed = 0;
        int optionalFailed = 0;

        for (StoreRole role : StoreRole.values()) {
            StoreHealth health = storeHealth(role);
            perStore.put(role.getStoreName(), health.toMap());

            boolean failed = !health.isHealthy();
            if (!role.isCritical()
                    && circuitBreakers.get(role).getState() == CircuitBreakerState.OPEN) {
                failed = true;
            }
            if (failed) {
                if (role.isCritical()) {
                    criticalFailed++;
                } else {
                    optionalFailed++;
                }
            }
        }

        String coordinatorStatus;
        if (criticalFailed > 0) {
            coordinatorStatus = String.format("%s (%d/%d critical failed)", SystemStatus.CRITICAL_FAILURE.getValue(),
                    criticalFailed, StoreRole.criticalRoles().size());
        } else if (optionalFailed > 0) {
            coordinatorStatus = String.format("%s (%d/%d optional failed)", SystemStatus.DEGRADED.getValue(),
                    optionalFailed, StoreRole.optionalRoles().size());
        } else {
            coordinatorStatus = SystemStatus.HEALTHY.getValue();
        }

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("coordinator_status", coordinatorStatus);
        report.put("per_store", perStore);
        report.put("circuit_breakers", circuitBreakers.getAllStatus());
        report.put("active_transaction_count", registry.activeCount());
        report.put("metrics", getMetrics());
        report.put("timestamp", Instant.now().toString());
        return report;
    }

    public Map<String, Object> getMetrics() {
        long total = totalTransactions.get();
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("totalTransactions", total);
        metrics.put("committedTransactions", committedTransactions.get());
        metrics.put("failedTransactions", failedTransactions.get());
        metrics.put("rolledBackTransactions", rolledBackTransactions.get());
        metrics.put("averageTransactionTimeMs", total == 0 ? 0.0 : totalTransactionTimeMs.sum() / total);
        return metrics;
    }

    public int activeTransactionCount() {
        return registry.activeCount();
    }

    public CircuitBreakerManager getCircuitBreakers() {
        return circuitBreakers;
    }

    public StoreTopology getTopology() {
        return topology;
    }

    @Override
    public void close() {
        dispatchExecutor.shutdownNow();
    }

    private SyncResult execute(OperationKind kind, String docId, DocumentRecord requested, String operationName) {
        long startNanos = System.nanoTime();
        SyncTransaction transaction = SyncTransaction.create();
        registerTransaction(transaction);
        List<PerformanceSlaExceededException> slaViolations = new CopyOnWriteArrayList<>();
        try {
            transaction.markStarted();
            logger.debug("Starting {} transaction {} for document {}",
                    kind.getValue(), transaction.getTransactionId(), docId);

            Optional<DocumentRecord> previous;
            try {
                previous = readRelationalImage(docId);
            } catch (RuntimeException e) {
                addOperations(transaction, kind, docId, kind == OperationKind.DELETE ? null : requested);
                StoreOperation relational = transaction.operationsFor(StoreRole.RELATIONAL).get(0);
                relational.markStarted();
                relational.markCompleted(false, "pre-write journal read failed: " + e.getMessage());
                SyncException failure = failTransaction(transaction, List.of(StoreRole.RELATIONAL),
                        "Critical database failure in relational store for transaction " + transaction.getTransactionId());
                return failureResult(transaction, docId, startNanos, failure, slaViolations);
            }

            if (kind == OperationKind.UPDATE && previous.isEmpty()) {
                transaction.markCompleted(false);
                recordOutcome(false, SlaPolicy.elapsedMs(startNanos));
                logger.warn("Update rejected, document {} not found in relational store", docId);
                return SyncResult.builder()
                        .success(false)
                        .docId(docId)
                        .transactionId(transaction.getTransactionId())
                        .executionTimeMs(SlaPolicy.elapsedMs(startNanos))
                        .error("Document " + docId + " not found in relational store")
                        .build();
            }

            final DocumentRecord image = previous.orElse(null);
            DocumentRecord document = requested;
            if (kind == OperationKind.UPDATE) {
                document = requested.toBuilder()
                        .createdAt(image.getCreatedAt())
                        .updatedAt(Instant.now())
                        .build();
            } else if (kind == OperationKind.DELETE) {
                document = image;
            }
            addOperations(transaction, kind, docId, document);
            transaction.getOperations().forEach(op -> op.journal(image));

            long criticalStartNanos = System.nanoTime();
            for (StoreRole role : StoreRole.criticalRoles()) {
                if (!executeOperation(transaction.operationsFor(role).get(0))) {
                    checkSla(PerformanceSla.CRITICAL_FAILURE_DETECTION, operationName,
                            SlaPolicy.elapsedMs(criticalStartNanos), slaViolations);
                    List<StoreRole> failedCritical = transaction.failedRoles(StoreRole.Priority.CRITICAL);
                    SyncException failure = failTransaction(transaction, failedCritical,
                            "Critical database failure in " + storeNames(failedCritical)
                                    + " for transaction " + transaction.getTransactionId());
                    return failureResult(transaction, docId, startNanos, failure, slaViolations);
                }
            }

            runOptionalPhase(transaction, slaViolations);
            transaction.markCompleted(true);
            return successResult(transaction, docId, startNanos, slaViolations, kind != OperationKind.DELETE);
        } catch (RuntimeException e) {
            logger.error("Transaction {} for document {} aborted unexpectedly", transaction.getTransactionId(), docId, e);
            SyncException failure = failTransaction(transaction, transaction.failedRoles(StoreRole.Priority.CRITICAL),
                    "Transaction " + transaction.getTransactionId() + " aborted: " + e.getMessage());
            return failureResult(transaction, docId, startNanos, failure, slaViolations);
        } finally {
            deregisterTransaction(transaction);
        }
    }

    private void addOperations(SyncTransaction transaction, OperationKind kind, String docId, DocumentRecord document) {
        for (StoreRole role : StoreRole.values()) {
            transaction.addOperation(kind, role, docId, document);
        }
    }

    private void runOptionalPhase(SyncTransaction transaction, List<PerformanceSlaExceededException> slaViolations) {
        List<CompletableFuture<Boolean>> futures = new ArrayList<>();
        for (StoreRole role : StoreRole.optionalRoles()) {
            for (StoreOperation operation : transaction.operationsFor(role)) {
                futures.add(CompletableFuture.supplyAsync(
                        () -> executeOptionalOperation(operation, slaViolations), dispatchExecutor));
            }
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
    }

    // Primitives shared with TransactionScope

    void registerTransaction(SyncTransaction transaction) {
        registry.register(transaction);
    }

    void deregisterTransaction(SyncTransaction transaction) {
        registry.deregister(transaction.getTransactionId());
    }

    Optional<DocumentRecord> readRelationalImage(String docId) {
        CriticalStoreAdapter relational = topology.getRelational();
        return storeCalls.call(StoreRole.RELATIONAL, () -> relational.retrieveDocument(docId));
    }

    /**
     * Run a critical operation directly against its store. Never throws for store failures.
     */
    boolean executeOperation(StoreOperation operation) {
        StoreRole role = operation.getRole();
        StoreAdapter adapter = topology.adapterFor(role);
        operation.markStarted();
        if (adapter == null) {
            operation.markCompleted(false, role.getStoreName() + " store not configured");
            return false;
        }
        try {
            boolean ok = storeCalls.call(role, () -> invoke(adapter, operation));
            operation.markCompleted(ok, ok ? null : role.getStoreName() + " store reported failure");
            if (ok) {
                logger.debug("{} {} committed for {}", role.getStoreName(), operation.getKind().getValue(),
                        operation.getDocumentId());
            } else {
                logger.error("{} {} reported failure for {}", role.getStoreName(), operation.getKind().getValue(),
                        operation.getDocumentId());
            }
            return ok;
        } catch (StoreCallTimeoutException e) {
            operation.markTimedOut(e.getMessage(), e.getSettled());
            logger.error("{} {} timed out for {}, outcome unknown: {}", role.getStoreName(),
                    operation.getKind().getValue(), operation.getDocumentId(), e.getMessage());
            return false;
        } catch (RuntimeException e) {
            operation.markCompleted(false, e.getMessage());
            logger.error("{} {} failed for {}: {}", role.getStoreName(), operation.getKind().getValue(),
                    operation.getDocumentId(), e.getMessage());
            return false;
        }
    }

    /**
     * Run an optional operation through its circuit breaker. Never throws; a rejection or a
     * store failure only fails this operation.
     */
    boolean executeOptionalOperation(StoreOperation operation, List<PerformanceSlaExceededException> slaViolations) {
        StoreRole role = operation.getRole();
        StoreAdapter adapter = topology.adapterFor(role);
        operation.markStarted();
        if (adapter == null) {
            operation.markCompleted(false, role.getStoreName() + " store not configured");
            logger.warn("Optional {} store not configured, continuing degraded", role.getStoreName());
            return false;
        }
        long startNanos = System.nanoTime();
        try {
            circuitBreakers.execute(role, () -> {
                if (!storeCalls.call(role, () -> invoke(adapter, operation))) {
                    throw new IllegalStateException(role.getStoreName() + " store reported failure");
                }
                return Boolean.TRUE;
            });
            operation.markCompleted(true, null);
            logger.debug("{} {} committed for {}", role.getStoreName(), operation.getKind().getValue(),
                    operation.getDocumentId());
            return true;
        } catch (CircuitBreakerOpenException e) {
            operation.markCompleted(false, e.getMessage());
            checkSla(PerformanceSla.CIRCUIT_BREAKER_SHORT_CIRCUIT, "circuit_breaker_short_circuit:" + role.getStoreName(),
                    SlaPolicy.elapsedMs(startNanos), slaViolations);
            logger.warn("Skipping {} store, circuit breaker open: {}", role.getStoreName(), e.getMessage());
            return false;
        } catch (StoreCallTimeoutException e) {
            operation.markTimedOut(e.getMessage(), e.getSettled());
            logger.warn("Optional {} {} timed out for {}, continuing degraded: {}", role.getStoreName(),
                    operation.getKind().getValue(), operation.getDocumentId(), e.getMessage());
            return false;
        } catch (RuntimeException e) {
            operation.markCompleted(false, e.getMessage());
            logger.warn("Optional {} {} failed for {}, continuing degraded: {}", role.getStoreName(),
                    operation.getKind().getValue(), operation.getDocumentId(), e.getMessage());
            return false;
        }
    }

    private boolean invoke(StoreAdapter adapter, StoreOperation operation) {
        switch (operation.getKind()) {
            case CREATE:
            case UPDATE:
                return adapter.storeDocument(operation.getDocument());
            case DELETE:
                return adapter.deleteDocument(operation.getDocumentId());
            case RETRIEVE:
                if (adapter instanceof CriticalStoreAdapter) {
                    Optional<DocumentRecord> found = ((CriticalStoreAdapter) adapter).retrieveDocument(operation.getDocumentId());
                    operation.setRetrieved(found.orElse(null));
                    return found.isPresent();
                }
                return adapter.documentExists(operation.getDocumentId());
            default:
                throw new IllegalArgumentException("Unsupported operation kind: " + operation.getKind());
        }
    }

    /**
     * Abandon pending operations, undo committed ones and build the typed failure: an
     * {@link AtomicTransactionException}, or a {@link RollbackException} wrapping it when some
     * store could not be undone.
     */
    SyncException failTransaction(SyncTransaction transaction, List<StoreRole> failedCritical, String message) {
        AtomicTransactionException atomicFailure =
                new AtomicTransactionException(message, storeNames(failedCritical), transaction.getTransactionId());
        logger.error(message);
        transaction.abandonPending();
        transaction.markCompleted(false);

        List<StoreRole> unrecovered = rollback(transaction);
        if (unrecovered.isEmpty()) {
            return atomicFailure;
        }
        String rollbackMessage = "Rollback of transaction " + transaction.getTransactionId()
                + " incomplete, partial writes remain in " + storeNames(unrecovered);
        logger.error(rollbackMessage);
        return new RollbackException(rollbackMessage, storeNames(unrecovered), transaction.getTransactionId(),
                atomicFailure);
    }

    /**
     * Undo committed operations in reverse order. A failed step does not stop later steps.
     * Writes that timed out are undone too, after waiting for the late call to finish; one still
     * running after the settle timeout is undone anyway and reported unrecovered.
     *
     * @return the stores whose writes could not be undone
     */
    List<StoreRole> rollback(SyncTransaction transaction) {
        List<StoreOperation> operations = new ArrayList<>(transaction.getOperations());
        Collections.reverse(operations);
        List<StoreRole> unrecovered = new ArrayList<>();
        int undone = 0;

        for (StoreOperation operation : operations) {
            if (!operation.needsUndo()) {
                continue;
            }
            StoreRole role = operation.getRole();
            StoreAdapter adapter = topology.adapterFor(role);
            boolean settled = !operation.isOutcomeUnknown()
                    || storeCalls.awaitSettled(role, operation.getLateCall());
            try {
                if (adapter != null && storeCalls.call(role, () -> undo(adapter, operation)) && settled) {
                    undone++;
                    logger.debug("Rolled back {} {} for {}", role.getStoreName(), operation.getKind().getValue(),
                            operation.getDocumentId());
                } else {
                    unrecovered.add(role);
                    logger.error("Rollback of {} {} reported failure for {}", role.getStoreName(),
                            operation.getKind().getValue(), operation.getDocumentId());
                }
            } catch (RuntimeException e) {
                unrecovered.add(role);
                logger.error("Rollback of {} {} failed for {}: {}", role.getStoreName(),
                        operation.getKind().getValue(), operation.getDocumentId(), e.getMessage());
            }
        }

        transaction.markRollbackAttempted(unrecovered.isEmpty());
        rolledBackTransactions.incrementAndGet();
        logger.info("Rollback of transaction {} finished: {} operations undone, {} unrecovered",
                transaction.getTransactionId(), undone, unrecovered.size());
        return unrecovered;
    }

    private boolean undo(StoreAdapter adapter, StoreOperation operation) {
        DocumentRecord image = operation.getRollbackImage();
        switch (operation.getKind()) {
            case CREATE:
            case UPDATE:
                return image != null
                        ? adapter.storeDocument(image)
                        : adapter.deleteDocument(operation.getDocumentId());
            case DELETE:
                return image == null || adapter.storeDocument(image);
            default:
                return true;
        }
    }

    SyncResult successResult(SyncTransaction transaction, String docId, long startNanos,
                             List<PerformanceSlaExceededException> slaViolations, boolean validate) {
        List<StoreRole> degraded = transaction.failedRoles(StoreRole.Priority.OPTIONAL);
        Map<StoreRole, String> impact = new EnumMap<>(StoreRole.class);
        degraded.forEach(role -> impact.put(role, role.getFunctionalityImpact()));
        SystemStatus status = degraded.isEmpty() ? SystemStatus.HEALTHY : SystemStatus.DEGRADED;

        ConsistencyReport report = null;
        if (validate && status == SystemStatus.HEALTHY && docId != null) {
            try {
                report = validator.validate(docId);
            } catch (ConsistencyValidationException e) {
                logger.warn("Post-write consistency validation failed for {}: {}", docId, e.getMessage());
            }
        }

        double elapsedMs = SlaPolicy.elapsedMs(startNanos);
        recordOutcome(true, elapsedMs);
        if (status == SystemStatus.DEGRADED) {
            logger.warn("Transaction {} committed degraded, unavailable: {}",
                    transaction.getTransactionId(), storeNames(degraded));
        } else {
            logger.info("Transaction {} committed for {} in {}ms",
                    transaction.getTransactionId(), docId, String.format("%.2f", elapsedMs));
        }

        return SyncResult.builder()
                .success(true)
                .docId(docId)
                .transactionId(transaction.getTransactionId())
                .executionTimeMs(elapsedMs)
                .affectedStores(transaction.committedOperations().stream()
                        .map(StoreOperation::getRole).distinct().collect(Collectors.toList()))
                .systemStatus(status)
                .degradedStores(degraded)
                .functionalityImpact(impact)
                .consistencyReport(report)
                .slaViolations(List.copyOf(slaViolations))
                .build();
    }

    private SyncResult failureResult(SyncTransaction transaction, String docId, long startNanos, SyncException failure,
                                     List<PerformanceSlaExceededException> slaViolations) {
        double elapsedMs = SlaPolicy.elapsedMs(startNanos);
        recordOutcome(false, elapsedMs);
        return SyncResult.builder()
                .success(false)
                .docId(docId)
                .transactionId(transaction.getTransactionId())
                .executionTimeMs(elapsedMs)
                .systemStatus(SystemStatus.CRITICAL_FAILURE)
                .error(failure.getMessage())
                .failure(failure)
                .rollbackAttempted(transaction.isRollbackAttempted())
                .rollbackSucceeded(transaction.isRollbackSucceeded())
                .slaViolations(List.copyOf(slaViolations))
                .build();
    }

    void recordOutcome(boolean committed, double elapsedMs) {
        totalTransactions.incrementAndGet();
        if (committed) {
            committedTransactions.incrementAndGet();
        } else {
            failedTransactions.incrementAndGet();
        }
        totalTransactionTimeMs.add(elapsedMs);
    }

    private Optional<DocumentRecord> retrieveWithFallback(String docId) {
        try {
            return readRelationalImage(docId);
        } catch (RuntimeException e) {
            logger.warn("Relational read failed for {}, trying vector store: {}", docId, e.getMessage());
        }
        CriticalStoreAdapter vector = topology.getVector();
        try {
            return storeCalls.call(StoreRole.VECTOR, () -> vector.retrieveDocument(docId));
        } catch (RuntimeException e) {
            logger.error("Failed to retrieve document {} from any critical store", docId, e);
            return Optional.empty();
        }
    }

    private StoreHealth storeHealth(StoreRole role) {
        StoreAdapter adapter = topology.adapterFor(role);
        if (adapter == null) {
            return StoreHealth.notConfigured();
        }
        try {
            return storeCalls.call(role, adapter::healthStatus);
        } catch (RuntimeException e) {
            logger.warn("Health check of {} store failed: {}", role.getStoreName(), e.getMessage());
            return StoreHealth.error(e);
        }
    }

    private SyncResult enforceSingleOperation(SyncResult result, String operationName) {
        enforceSla(PerformanceSla.SINGLE_OPERATION, operationName, result.getExecutionTimeMs(), List.of(result));
        return result;
    }

    private SyncResult recordSingleOperation(SyncResult result, String operationName) {
        Optional<PerformanceSlaExceededException> violation = slaPolicy.check(PerformanceSla.SINGLE_OPERATION,
                operationName, result.getExecutionTimeMs(), List.of());
        if (violation.isEmpty()) {
            return result;
        }
        logger.warn(violation.get().getMessage());
        List<PerformanceSlaExceededException> violations = new ArrayList<>(result.getSlaViolations());
        violations.add(violation.get());
        return result.toBuilder().slaViolations(List.copyOf(violations)).build();
    }

    private void enforceSla(PerformanceSla sla, String operationName, double measuredMs, List<?> results) {
        Optional<PerformanceSlaExceededException> violation = slaPolicy.check(sla, operationName, measuredMs, results);
        if (violation.isPresent()) {
            logger.warn(violation.get().getMessage());
            throw violation.get();
        }
    }

    private void checkSla(PerformanceSla sla, String operationName, double measuredMs,
                          List<PerformanceSlaExceededException> slaViolations) {
        slaPolicy.check(sla, operationName, measuredMs, List.of()).ifPresent(violation -> {
            logger.warn(violation.getMessage());
            slaViolations.add(violation);
        });
    }

    static List<String> storeNames(List<StoreRole> roles) {
        return roles.stream().map(StoreRole::getStoreName).collect(Collectors.toList());
    }

    private static void requireId(String docId) {
        if (docId == null || docId.isBlank()) {
            throw new IllegalArgumentException("Document id must not be blank");
        }
    }
}
