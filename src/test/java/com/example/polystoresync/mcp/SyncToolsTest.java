package com.example.polystoresync.mcp;

import com.example.polystoresync.exception.ConsistencyValidationException;
import com.example.polystoresync.exception.PerformanceSlaExceededException;
import com.example.polystoresync.model.DocumentRecord;
import com.example.polystoresync.model.SyncResult;
import com.example.polystoresync.service.SyncCoordinator;
import com.example.polystoresync.store.InMemoryVectorStore;
import com.example.polystoresync.store.MongoGraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SyncToolsTest {

    @Mock
    private SyncCoordinator coordinator;

    @Mock
    private MongoGraphStore graphStore;

    private final InMemoryVectorStore vectorStore = new InMemoryVectorStore(128);

    private SyncTools tools;

    @BeforeEach
    void setUp() {
        tools = new SyncTools(coordinator, vectorStore, graphStore);
    }

    @Test
    void testStoreDocument_BuildsDocumentAndReturnsResult() {
        // Given
        ArgumentCaptor<DocumentRecord> captor = ArgumentCaptor.forClass(DocumentRecord.class);
        when(coordinator.storeDocument(any())).thenReturn(
                SyncResult.builder().success(true).docId("doc-1").transactionId("tx-1").build());

        // When
        Map<String, Object> response = tools.sync_store_document("doc-1", "content", List.of("alpha"),
                Map.of("source", "mcp"), "conv-1");

        // Then
        assertEquals(true, response.get("success"));
        assertEquals("healthy", response.get("systemStatus"));
        verify(coordinator).storeDocument(captor.capture());
        assertEquals(List.of("alpha"), captor.getValue().getTags());
        assertEquals("conv-1", captor.getValue().getConversationId());
    }

    @Test
    void testStoreDocument_BlankIdReportedAsError() {
        // When
        Map<String, Object> response = tools.sync_store_document("", "content", null, null, null);

        // Then
        assertEquals(false, response.get("success"));
        verifyNoInteractions(coordinator);
    }

    @Test
    void testStoreDocument_SlaExceededKeepsResult() {
        // Given
        SyncResult result = SyncResult.builder().success(true).docId("doc-1").build();
        when(coordinator.storeDocument(any())).thenThrow(
                new PerformanceSlaExceededException("store_document", 612.0, 500, List.of(result)));

        // When
        Map<String, Object> response = tools.sync_store_document("doc-1", "content", null, null, null);

        // Then
        assertEquals("performance_sla_exceeded", response.get("errorKind"));
        assertEquals(500L, response.get("limitMs"));
        assertEquals(1, ((List<?>) response.get("results")).size());
    }

    @Test
    void testRetrieveDocument_NotFound() {
        // Given
        when(coordinator.retrieveDocument("doc-9")).thenReturn(Optional.empty());

        // When
        Map<String, Object> response = tools.sync_retrieve_document("doc-9");

        // Then
        assertEquals(false, response.get("found"));
    }

    @Test
    void testValidateConsistency_FailureMappedToError() {
        // Given
        when(coordinator.validateConsistency("doc-1")).thenThrow(
                new ConsistencyValidationException("no store could be checked", "doc-1", null));

        // When
        Map<String, Object> response = tools.sync_validate_consistency("doc-1");

        // Then
        assertEquals("consistency_validation_failure", response.get("errorKind"));
    }

    @Test
    void testSearchSimilar_UsesVectorIndex() {
        // Given
        vectorStore.storeDocument(DocumentRecord.of("doc-1", "searchable words", List.of()));

        // When
        Map<String, Object> response = tools.sync_search_similar("searchable words", null);

        // Then
        List<?> results = (List<?>) response.get("results");
        assertEquals(1, results.size());
        assertEquals("doc-1", ((Map<?, ?>) results.get(0)).get("docId"));
    }

    @Test
    void testRelatedDocuments_GraphErrorReported() {
        // Given
        when(graphStore.relatedDocuments("doc-1")).thenThrow(new IllegalStateException("mongo down"));

        // When
        Map<String, Object> response = tools.sync_related_documents("doc-1");

        // Then
        assertEquals("mongo down", response.get("error"));
    }
}
