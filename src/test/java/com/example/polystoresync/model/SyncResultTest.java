package com.example.polystoresync.model;

import com.example.polystoresync.exception.AtomicTransactionException;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SyncResultTest {

    @Test
    void testToMap_DegradedResult() {
        // Given
        Map<StoreRole, String> impact = new EnumMap<>(StoreRole.class);
        impact.put(StoreRole.CACHE, StoreRole.CACHE.getFunctionalityImpact());
        SyncResult result = SyncResult.builder()
                .success(true)
                .docId("doc-1")
                .transactionId("tx-1")
                .affectedStores(List.of(StoreRole.RELATIONAL, StoreRole.VECTOR, StoreRole.GRAPH))
                .systemStatus(SystemStatus.DEGRADED)
                .degradedStores(List.of(StoreRole.CACHE))
                .functionalityImpact(impact)
                .build();

        // When
        Map<String, Object> map = result.toMap();

        // Then
        assertTrue(result.isDegraded());
        assertEquals("degraded", map.get("systemStatus"));
        assertEquals(List.of("cache"), map.get("degradedStores"));
        assertEquals(Map.of("cache", "low-latency cached reads unavailable; reads served from the relational store"),
                map.get("functionalityImpact"));
        assertFalse(map.containsKey("error"));
    }

    @Test
    void testToMap_CriticalFailureCarriesErrorKind() {
        // Given
        SyncResult result = SyncResult.builder()
                .success(false)
                .docId("doc-1")
                .systemStatus(SystemStatus.CRITICAL_FAILURE)
                .error("Critical database failure in [vector]")
                .failure(new AtomicTransactionException("Critical database failure in [vector]", List.of("vector"), "tx-1"))
                .rollbackAttempted(true)
                .rollbackSucceeded(true)
                .build();

        // When
        Map<String, Object> map = result.toMap();

        // Then
        assertEquals("critical_failure", map.get("systemStatus"));
        assertEquals("atomic_transaction_failure", map.get("errorKind"));
        assertEquals(true, map.get("rollbackSucceeded"));
    }
}
