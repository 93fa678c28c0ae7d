package com.example.polystoresync.service;

import com.example.polystoresync.exception.PerformanceSlaExceededException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SlaPolicyTest {

    @Test
    void testDefaults_MatchNamedLimits() {
        SlaPolicy policy = new SlaPolicy();

        assertEquals(500L, policy.limitMs(PerformanceSla.SINGLE_OPERATION));
        assertEquals(2000L, policy.limitMs(PerformanceSla.QUERY_OPERATION));
        assertEquals(5000L, policy.limitMs(PerformanceSla.BATCH_OPERATION));
        assertEquals(500L, policy.limitMs(PerformanceSla.CRITICAL_FAILURE_DETECTION));
        assertEquals(100L, policy.limitMs(PerformanceSla.CIRCUIT_BREAKER_SHORT_CIRCUIT));
    }

    @Test
    void testCheck_WithinLimitHasNoViolation() {
        SlaPolicy policy = new SlaPolicy();

        assertTrue(policy.check(PerformanceSla.SINGLE_OPERATION, "store_document", 499.9, List.of()).isEmpty());
        assertTrue(policy.check(PerformanceSla.SINGLE_OPERATION, "store_document", 500.0, List.of()).isEmpty());
    }

    @Test
    void testCheck_OverLimitCarriesMeasurement() {
        // Given
        SlaPolicy policy = new SlaPolicy(Map.of(PerformanceSla.QUERY_OPERATION, 50L));

        // When
        Optional<PerformanceSlaExceededException> violation =
                policy.check(PerformanceSla.QUERY_OPERATION, "validate_consistency", 75.5, List.of("report"));

        // Then
        assertTrue(violation.isPresent());
        assertEquals(75.5, violation.get().getMeasuredTimeMs());
        assertEquals(50L, violation.get().getLimitMs());
        assertEquals(List.of("report"), violation.get().getResults());
        assertEquals("Operation validate_consistency took 75.50ms, exceeds 50ms SLA", violation.get().getMessage());
    }

    @Test
    void testEnforce_Throws() {
        SlaPolicy policy = new SlaPolicy(Map.of(PerformanceSla.BATCH_OPERATION, 10L));

        assertThrows(PerformanceSlaExceededException.class,
                () -> policy.enforce(PerformanceSla.BATCH_OPERATION, "batch_store", 11, List.of()));
        assertDoesNotThrow(() -> policy.enforce(PerformanceSla.BATCH_OPERATION, "batch_store", 10, List.of()));
    }
}
