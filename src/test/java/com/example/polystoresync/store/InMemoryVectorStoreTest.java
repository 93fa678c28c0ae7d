package com.example.polystoresync.store;

import com.example.polystoresync.model.DocumentRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryVectorStoreTest {

    private final InMemoryVectorStore store = new InMemoryVectorStore(256);

    @Test
    void testStoreAndRetrieve() {
        // Given
        DocumentRecord document = DocumentRecord.of("doc-1", "vector content", List.of("x"));

        // When
        assertTrue(store.storeDocument(document));

        // Then
        assertTrue(store.documentExists("doc-1"));
        assertEquals(document, store.retrieveDocument("doc-1").orElseThrow());
    }

    @Test
    void testEmbed_IsUnitLength() {
        float[] vector = store.embed("the quick brown fox jumps");

        double norm = 0;
        for (float v : vector) {
            norm += v * v;
        }
        assertEquals(1.0, norm, 1e-5);
        assertEquals(256, vector.length);
    }

    @Test
    void testSearchSimilar_RanksClosestFirst() {
        // Given
        store.storeDocument(DocumentRecord.of("cats", "cats purr and nap in the sun", List.of()));
        store.storeDocument(DocumentRecord.of("rockets", "rockets launch payloads into orbit", List.of()));

        // When
        List<Map<String, Object>> hits = store.searchSimilar("rockets launch payloads", 2);

        // Then
        assertEquals(2, hits.size());
        assertEquals("rockets", hits.get(0).get("docId"));
    }

    @Test
    void testDeleteDocument_AbsentIdSucceeds() {
        store.storeDocument(DocumentRecord.of("doc-1", "content", List.of()));

        assertTrue(store.deleteDocument("doc-1"));
        assertTrue(store.deleteDocument("doc-1"));
        assertFalse(store.documentExists("doc-1"));
        assertEquals(0, store.healthStatus().getDetail().get("vectors"));
    }
}
