package com.example.polystoresync.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyncTransactionTest {

    private final DocumentRecord doc = DocumentRecord.of("doc-1", "content", List.of());

    @Test
    void testAddOperation_IdsAreStableAndOrdered() {
        // Given
        SyncTransaction transaction = new SyncTransaction("tx-1");

        // When
        StoreOperation first = transaction.addOperation(OperationKind.CREATE, StoreRole.RELATIONAL, "doc-1", doc);
        StoreOperation second = transaction.addOperation(OperationKind.CREATE, StoreRole.CACHE, "doc-1", doc);

        // Then
        assertEquals("tx-1_relational_0", first.getOperationId());
        assertEquals("tx-1_cache_1", second.getOperationId());
        assertEquals(List.of(first, second), transaction.getOperations());
        assertTrue(first.isCritical());
        assertFalse(second.isCritical());
    }

    @Test
    void testAddOperation_RejectedOnceTerminal() {
        SyncTransaction transaction = SyncTransaction.create();
        transaction.markCompleted(true);

        assertThrows(IllegalStateException.class,
                () -> transaction.addOperation(OperationKind.DELETE, StoreRole.GRAPH, "doc-1", null));
    }

    @Test
    void testAddOperation_WriteRequiresDocument() {
        SyncTransaction transaction = SyncTransaction.create();

        assertThrows(IllegalArgumentException.class,
                () -> transaction.addOperation(OperationKind.UPDATE, StoreRole.VECTOR, "doc-1", null));
    }

    @Test
    void testFailedRoles_ByPriority() {
        // Given
        SyncTransaction transaction = SyncTransaction.create();
        StoreOperation relational = transaction.addOperation(OperationKind.CREATE, StoreRole.RELATIONAL, "doc-1", doc);
        StoreOperation graph = transaction.addOperation(OperationKind.CREATE, StoreRole.GRAPH, "doc-1", doc);
        StoreOperation cache = transaction.addOperation(OperationKind.CREATE, StoreRole.CACHE, "doc-1", doc);

        // When
        relational.markStarted();
        relational.markCompleted(true, null);
        graph.markStarted();
        graph.markCompleted(false, "graph down");
        cache.markStarted();
        cache.markCompleted(true, null);

        // Then
        assertEquals(List.of(StoreRole.GRAPH), transaction.failedRoles(StoreRole.Priority.OPTIONAL));
        assertTrue(transaction.failedRoles(StoreRole.Priority.CRITICAL).isEmpty());
        assertEquals(2, transaction.committedOperations().size());
        assertEquals("graph down", graph.getError());
        assertNotNull(graph.getExecutionTimeMs());
    }

    @Test
    void testAbandon_FailsPendingOperationsOnly() {
        // Given
        SyncTransaction transaction = SyncTransaction.create();
        StoreOperation done = transaction.addOperation(OperationKind.CREATE, StoreRole.RELATIONAL, "doc-1", doc);
        StoreOperation pending = transaction.addOperation(OperationKind.CREATE, StoreRole.VECTOR, "doc-1", doc);
        done.markStarted();
        done.markCompleted(true, null);

        // When
        transaction.abandon();

        // Then
        assertTrue(done.isCommitted());
        assertTrue(pending.isFailed());
        assertEquals("abandoned before execution", pending.getError());
        assertEquals(TransactionStatus.ROLLED_BACK, transaction.getStatus());
    }

    @Test
    void testMarkRollbackAttempted_StatusReflectsOutcome() {
        SyncTransaction clean = SyncTransaction.create();
        clean.markRollbackAttempted(true);
        assertEquals(TransactionStatus.ROLLED_BACK, clean.getStatus());
        assertTrue(clean.isRollbackSucceeded());

        SyncTransaction partial = SyncTransaction.create();
        partial.markRollbackAttempted(false);
        assertEquals(TransactionStatus.FAILED, partial.getStatus());
        assertTrue(partial.isRollbackAttempted());
        assertFalse(partial.isRollbackSucceeded());
    }
}
