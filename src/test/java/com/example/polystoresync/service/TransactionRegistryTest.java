package com.example.polystoresync.service;

import com.example.polystoresync.model.SyncTransaction;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TransactionRegistryTest {

    @Test
    void testRegisterAndDeregister() {
        // Given
        TransactionRegistry registry = new TransactionRegistry();
        SyncTransaction transaction = SyncTransaction.create();

        // When
        registry.register(transaction);

        // Then
        assertEquals(1, registry.activeCount());
        assertSame(transaction, registry.get(transaction.getTransactionId()).orElseThrow());

        // When
        registry.deregister(transaction.getTransactionId());

        // Then
        assertEquals(0, registry.activeCount());
        assertTrue(registry.get(transaction.getTransactionId()).isEmpty());
    }

    @Test
    void testRegister_DuplicateIdRejected() {
        TransactionRegistry registry = new TransactionRegistry();
        registry.register(new SyncTransaction("tx-1"));

        assertThrows(IllegalStateException.class, () -> registry.register(new SyncTransaction("tx-1")));
    }

    @Test
    void testRegistries_AreIndependent() {
        TransactionRegistry first = new TransactionRegistry();
        TransactionRegistry second = new TransactionRegistry();

        first.register(SyncTransaction.create());

        assertEquals(1, first.activeCount());
        assertEquals(0, second.activeCount());
    }
}
