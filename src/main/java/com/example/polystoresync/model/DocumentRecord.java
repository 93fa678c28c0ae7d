package com.example.polystoresync.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A logical document fanned out to every store.
 * Immutable; timestamps default to creation time when absent.
 */
@Value
public class DocumentRecord {

    String id;
    String content;
    List<String> tags;
    Map<String, Object> metadata;
    Instant createdAt;
    Instant updatedAt;
    String conversationId;

    @Builder(toBuilder = true)
    public DocumentRecord(String id, String content, List<String> tags, Map<String, Object> metadata,
                          Instant createdAt, Instant updatedAt, String conversationId) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Document id must not be blank");
        }
        this.id = id;
        this.content = Objects.requireNonNullElse(content, "");
        this.tags = tags == null ? List.of() : List.copyOf(tags);
        this.metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.createdAt = createdAt != null ? createdAt : Instant.now();
        this.updatedAt = updatedAt != null ? updatedAt : this.createdAt;
        this.conversationId = conversationId;
    }

    public static DocumentRecord of(String id, String content, List<String> tags) {
        return DocumentRecord.builder().id(id).content(content).tags(tags).build();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.put("content", content);
        map.put("tags", tags);
        map.put("metadata", metadata);
        map.put("createdAt", createdAt.toString());
        map.put("updatedAt", updatedAt.toString());
        map.put("conversationId", conversationId);
        return map;
    }
}
