package com.example.polystoresync.store;

import com.example.polystoresync.kv.KvClient;
import com.example.polystoresync.model.DocumentRecord;
import com.example.polystoresync.model.StoreHealth;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisCacheStoreTest {

    @Mock
    private KvClient kvClient;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RedisCacheStore store;

    @BeforeEach
    void setUp() {
        store = new RedisCacheStore(kvClient, objectMapper, 600);
    }

    @Test
    void testStoreDocument_WritesJsonWithTtl() throws Exception {
        // Given
        DocumentRecord document = DocumentRecord.of("doc-1", "cached content", List.of("alpha"));
        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);

        // When
        assertTrue(store.storeDocument(document));

        // Then
        verify(kvClient).set(eq("polystore:doc:doc-1"), payload.capture(), eq(Duration.ofSeconds(600)));
        Map<?, ?> json = objectMapper.readValue(payload.getValue(), Map.class);
        assertEquals("doc-1", json.get("id"));
        assertEquals("cached content", json.get("content"));
        assertEquals(List.of("alpha"), json.get("tags"));
        assertEquals(600, json.get("ttl"));
        assertNotNull(json.get("cachedAt"));
    }

    @Test
    void testDeleteDocument_AbsentKeySucceeds() {
        // Given
        when(kvClient.del("polystore:doc:missing")).thenReturn(false);

        // When / Then
        assertTrue(store.deleteDocument("missing"));
    }

    @Test
    void testDocumentExists_UsesPrefixedKey() {
        // Given
        when(kvClient.exists("polystore:doc:doc-1")).thenReturn(true);

        // When / Then
        assertTrue(store.documentExists("doc-1"));
    }

    @Test
    void testHealthStatus_PingFailure() {
        // Given
        when(kvClient.ping()).thenReturn(false);

        // When
        StoreHealth health = store.healthStatus();

        // Then
        assertEquals(StoreHealth.UNHEALTHY, health.getStatus());
        verify(kvClient, never()).scan(anyString(), anyInt());
    }

    @Test
    void testHealthStatus_HealthyCountsCachedDocuments() {
        // Given
        when(kvClient.ping()).thenReturn(true);
        when(kvClient.scan("polystore:doc:", 1000)).thenReturn(List.of("polystore:doc:a", "polystore:doc:b"));

        // When
        StoreHealth health = store.healthStatus();

        // Then
        assertTrue(health.isHealthy());
        assertEquals(2, health.getDetail().get("cachedDocuments"));
    }

    @Test
    void testHealthStatus_ConnectionErrorReported() {
        // Given
        when(kvClient.ping()).thenThrow(new IllegalStateException("Connection refused"));

        // When
        StoreHealth health = store.healthStatus();

        // Then
        assertEquals(StoreHealth.ERROR, health.getStatus());
        assertEquals("Connection refused", health.getDetail().get("error"));
    }
}
