package com.example.polystoresync.store;

import com.example.polystoresync.model.DocumentRecord;
import com.example.polystoresync.model.StoreHealth;
import com.example.polystoresync.model.StoreRole;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Relational source of truth for document metadata. Tags and metadata are kept as JSON columns
 * of the {@code documents} table (see {@code schema.sql}).
 */
@Component
public class JdbcRelationalStore implements CriticalStoreAdapter {

    private static final Logger logger = LoggerFactory.getLogger(JdbcRelationalStore.class);

    private static final TypeReference<List<String>> TAGS_TYPE = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private static final int MAX_UPSERT_ATTEMPTS = 3;

    // Single-statement upsert. Two first writes of one id can still race inside the database;
    // the loser is retried and then takes the update path.
    private static final String UPSERT_SQL =
            "MERGE INTO documents (id, content, tags, metadata, conversation_id, created_at, updated_at) "
                    + "KEY (id) VALUES (?, ?, ?, ?, ?, ?, ?)";
    private static final String SELECT_SQL =
            "SELECT id, content, tags, metadata, conversation_id, created_at, updated_at FROM documents WHERE id = ?";

    private final JdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final RowMapper<DocumentRecord> rowMapper;

    public JdbcRelationalStore(JdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.rowMapper = (rs, rowNum) -> DocumentRecord.builder()
                .id(rs.getString("id"))
                .content(rs.getString("content"))
                .tags(fromJson(rs.getString("tags"), TAGS_TYPE))
                .metadata(fromJson(rs.getString("metadata"), METADATA_TYPE))
                .conversationId(rs.getString("conversation_id"))
                .createdAt(rs.getTimestamp("created_at").toInstant())
                .updatedAt(rs.getTimestamp("updated_at").toInstant())
                .build();
    }

    @Override
    public StoreRole getRole() {
        return StoreRole.RELATIONAL;
    }

    @Override
    public boolean storeDocument(DocumentRecord document) {
        String tags = toJson(document.getTags());
        String metadata = toJson(document.getMetadata());
        Timestamp createdAt = Timestamp.from(document.getCreatedAt());
        Timestamp updatedAt = Timestamp.from(document.getUpdatedAt());

        for (int attempt = 1; ; attempt++) {
            try {
                jdbc.update(UPSERT_SQL, document.getId(), document.getContent(), tags, metadata,
                        document.getConversationId(), createdAt, updatedAt);
                break;
            } catch (DuplicateKeyException | ConcurrencyFailureException e) {
                if (attempt >= MAX_UPSERT_ATTEMPTS) {
                    throw e;
                }
                logger.debug("Concurrent upsert of document {}, retrying (attempt {})", document.getId(), attempt);
            }
        }
        logger.debug("Stored document {} in relational store", document.getId());
        return true;
    }

    @Override
    public boolean deleteDocument(String docId) {
        int deleted = jdbc.update("DELETE FROM documents WHERE id = ?", docId);
        logger.debug("Deleted {} row(s) for document {} from relational store", deleted, docId);
        return true;
    }

    @Override
    public boolean documentExists(String docId) {
        Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM documents WHERE id = ?", Integer.class, docId);
        return count != null && count > 0;
    }

    @Override
    public Optional<DocumentRecord> retrieveDocument(String docId) {
        List<DocumentRecord> rows = jdbc.query(SELECT_SQL, rowMapper, docId);
        return rows.stream().findFirst();
    }

    @Override
    public StoreHealth healthStatus() {
        try {
            Long documents = jdbc.queryForObject("SELECT COUNT(*) FROM documents", Long.class);
            return StoreHealth.healthy(Map.of("documents", documents == null ? 0L : documents));
        } catch (DataAccessException e) {
            logger.warn("Relational store health check failed: {}", e.getMessage());
            return StoreHealth.error(e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Document field is not serializable to JSON", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt JSON column in documents table", e);
        }
    }
}
