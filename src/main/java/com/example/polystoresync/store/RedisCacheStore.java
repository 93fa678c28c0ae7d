package com.example.polystoresync.store;

import com.example.polystoresync.kv.KvClient;
import com.example.polystoresync.model.DocumentRecord;
import com.example.polystoresync.model.StoreHealth;
import com.example.polystoresync.model.StoreRole;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Low-latency copy of each document in the key-value cache, expiring after a fixed TTL.
 */
@Component
public class RedisCacheStore implements StoreAdapter {

    private static final Logger logger = LoggerFactory.getLogger(RedisCacheStore.class);

    static final String KEY_PREFIX = "polystore:doc:";
    private static final int HEALTH_SCAN_LIMIT = 1000;

    private final KvClient kvClient;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public RedisCacheStore(KvClient kvClient, ObjectMapper objectMapper,
                           @Value("${app.cache.ttl-seconds:3600}") long ttlSeconds) {
        this.kvClient = kvClient;
        this.objectMapper = objectMapper;
        this.ttl = Duration.ofSeconds(ttlSeconds);
    }

    @Override
    public StoreRole getRole() {
        return StoreRole.CACHE;
    }

    @Override
    public boolean storeDocument(DocumentRecord document) {
        Map<String, Object> payload = new LinkedHashMap<>(document.toMap());
        payload.put("cachedAt", Instant.now().toString());
        payload.put("ttl", ttl.toSeconds());

        String value;
        try {
            value = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Document " + document.getId() + " is not serializable to JSON", e);
        }
        kvClient.set(cacheKey(document.getId()), value, ttl);
        logger.debug("Cached document {} (TTL: {}s)", document.getId(), ttl.toSeconds());
        return true;
    }

    @Override
    public boolean deleteDocument(String docId) {
        boolean removed = kvClient.del(cacheKey(docId));
        logger.debug("Evicted document {} from cache (present: {})", docId, removed);
        return true;
    }

    @Override
    public boolean documentExists(String docId) {
        return kvClient.exists(cacheKey(docId));
    }

    @Override
    public StoreHealth healthStatus() {
        try {
            if (!kvClient.ping()) {
                return StoreHealth.unhealthy("ping failed");
            }
            return StoreHealth.healthy(Map.of(
                    "cachedDocuments", kvClient.scan(KEY_PREFIX, HEALTH_SCAN_LIMIT).size(),
                    "ttlSeconds", ttl.toSeconds()));
        } catch (RuntimeException e) {
            logger.warn("Cache store health check failed: {}", e.getMessage());
            return StoreHealth.error(e);
        }
    }

    static String cacheKey(String docId) {
        return KEY_PREFIX + docId;
    }
}
