package com.example.polystoresync.service;

import com.example.polystoresync.exception.ConsistencyValidationException;
import com.example.polystoresync.model.ConsistencyReport;
import com.example.polystoresync.model.StoreRole;
import com.example.polystoresync.store.CriticalStoreAdapter;
import com.example.polystoresync.store.StoreAdapter;
import com.example.polystoresync.store.StoreTopology;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConsistencyValidatorTest {

    @Mock
    private CriticalStoreAdapter relational;

    @Mock
    private CriticalStoreAdapter vector;

    @Mock
    private StoreAdapter graph;

    @Mock
    private StoreAdapter cache;

    private StoreCallExecutor storeCalls;

    @BeforeEach
    void setUp() {
        storeCalls = new StoreCallExecutor(1000, 4);
    }

    @AfterEach
    void tearDown() {
        storeCalls.close();
    }

    @Test
    void testValidate_AllStoresHoldDocument() {
        // Given
        when(relational.documentExists("doc-1")).thenReturn(true);
        when(vector.documentExists("doc-1")).thenReturn(true);
        when(graph.documentExists("doc-1")).thenReturn(true);
        when(cache.documentExists("doc-1")).thenReturn(true);
        ConsistencyValidator validator = new ConsistencyValidator(
                new StoreTopology(relational, vector, graph, cache), storeCalls);

        // When
        ConsistencyReport report = validator.validate("doc-1");

        // Then
        assertTrue(report.isOverallConsistent());
        assertTrue(report.getInconsistencies().isEmpty());
    }

    @Test
    void testValidate_MissingAndErroringStoresReported() {
        // Given
        when(relational.documentExists("doc-1")).thenReturn(true);
        when(vector.documentExists("doc-1")).thenReturn(true);
        when(graph.documentExists("doc-1")).thenThrow(new IllegalStateException("graph timeout"));
        when(cache.documentExists("doc-1")).thenReturn(false);
        ConsistencyValidator validator = new ConsistencyValidator(
                new StoreTopology(relational, vector, graph, cache), storeCalls);

        // When
        ConsistencyReport report = validator.validate("doc-1");

        // Then
        assertFalse(report.isOverallConsistent());
        assertTrue(report.isConsistent(StoreRole.RELATIONAL));
        assertFalse(report.isConsistent(StoreRole.GRAPH));
        assertFalse(report.isConsistent(StoreRole.CACHE));
        assertEquals(2, report.getInconsistencies().size());
        assertTrue(report.getInconsistencies().get(0).startsWith("[graph]"));
        assertTrue(report.getInconsistencies().get(0).contains("graph timeout"));
        assertEquals("[cache] document missing", report.getInconsistencies().get(1));
    }

    @Test
    void testValidate_UnwiredStoreIsInconsistent() {
        // Given
        when(relational.documentExists("doc-1")).thenReturn(true);
        when(vector.documentExists("doc-1")).thenReturn(true);
        when(graph.documentExists("doc-1")).thenReturn(true);
        ConsistencyValidator validator = new ConsistencyValidator(
                new StoreTopology(relational, vector, graph, null), storeCalls);

        // When
        ConsistencyReport report = validator.validate("doc-1");

        // Then
        assertFalse(report.isOverallConsistent());
        assertEquals("[cache] store not configured", report.getInconsistencies().get(0));
    }

    @Test
    void testValidate_RepeatedRunsProduceEqualReports() {
        // Given
        when(relational.documentExists("doc-1")).thenReturn(true);
        when(vector.documentExists("doc-1")).thenReturn(false);
        when(graph.documentExists("doc-1")).thenReturn(true);
        when(cache.documentExists("doc-1")).thenReturn(true);
        ConsistencyValidator validator = new ConsistencyValidator(
                new StoreTopology(relational, vector, graph, cache), storeCalls);

        // When
        ConsistencyReport first = validator.validate("doc-1");
        ConsistencyReport second = validator.validate("doc-1");

        // Then
        assertEquals(first, second);
        verify(vector, times(2)).documentExists("doc-1");
    }

    @Test
    void testValidate_EveryStoreErroringRaises() {
        // Given
        when(relational.documentExists("doc-1")).thenThrow(new IllegalStateException("down"));
        when(vector.documentExists("doc-1")).thenThrow(new IllegalStateException("down"));
        when(graph.documentExists("doc-1")).thenThrow(new IllegalStateException("down"));
        when(cache.documentExists("doc-1")).thenThrow(new IllegalStateException("down"));
        ConsistencyValidator validator = new ConsistencyValidator(
                new StoreTopology(relational, vector, graph, cache), storeCalls);

        // When
        ConsistencyValidationException e = assertThrows(ConsistencyValidationException.class,
                () -> validator.validate("doc-1"));

        // Then
        assertEquals("doc-1", e.getDocId());
        assertEquals("consistency_validation_failure", e.getKind());
    }
}
