package com.example.polystoresync.mcp;

import com.example.polystoresync.exception.PerformanceSlaExceededException;
import com.example.polystoresync.exception.SyncException;
import com.example.polystoresync.model.ConsistencyReport;
import com.example.polystoresync.model.DocumentRecord;
import com.example.polystoresync.model.SyncResult;
import com.example.polystoresync.service.SyncCoordinator;
import com.example.polystoresync.store.InMemoryVectorStore;
import com.example.polystoresync.store.MongoGraphStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@Service
public class SyncTools {

    private static final Logger logger = LoggerFactory.getLogger(SyncTools.class);

    private final SyncCoordinator coordinator;
    private final InMemoryVectorStore vectorStore;
    private final MongoGraphStore graphStore;

    public SyncTools(SyncCoordinator coordinator, InMemoryVectorStore vectorStore, MongoGraphStore graphStore) {
        this.coordinator = coordinator;
        this.vectorStore = vectorStore;
        this.graphStore = graphStore;
    }

    @Tool(description = "Store a document atomically across the relational, vector, graph and cache stores")
    public Map<String, Object> sync_store_document(String id, String content, List<String> tags,
                                                   Map<String, Object> metadata, String conversationId) {
        try {
            SyncResult result = coordinator.storeDocument(toDocument(id, content, tags, metadata, conversationId));
            return result.toMap();
        } catch (PerformanceSlaExceededException e) {
            return slaExceeded(e);
        } catch (SyncException e) {
            return error(e);
        } catch (IllegalArgumentException e) {
            return Map.of("success", false, "error", String.valueOf(e.getMessage()));
        }
    }

    @Tool(description = "Update an existing document in every store, keeping its creation time")
    public Map<String, Object> sync_update_document(String id, String content, List<String> tags,
                                                    Map<String, Object> metadata, String conversationId) {
        try {
            SyncResult result = coordinator.updateDocument(toDocument(id, content, tags, metadata, conversationId));
            return result.toMap();
        } catch (PerformanceSlaExceededException e) {
            return slaExceeded(e);
        } catch (SyncException e) {
            return error(e);
        } catch (IllegalArgumentException e) {
            return Map.of("success", false, "error", String.valueOf(e.getMessage()));
        }
    }

    @Tool(description = "Delete a document from every store")
    public Map<String, Object> sync_delete_document(String id) {
        try {
            return coordinator.deleteDocument(id).toMap();
        } catch (PerformanceSlaExceededException e) {
            return slaExceeded(e);
        } catch (SyncException e) {
            return error(e);
        } catch (IllegalArgumentException e) {
            return Map.of("success", false, "error", String.valueOf(e.getMessage()));
        }
    }

    @Tool(description = "Read a document from the relational store")
    public Map<String, Object> sync_retrieve_document(String id) {
        try {
            Optional<DocumentRecord> document = coordinator.retrieveDocument(id);
            if (document.isEmpty()) {
                return Map.of("found", false, "docId", id);
            }
            return Map.of("found", true, "document", document.get().toMap());
        } catch (SyncException e) {
            return error(e);
        } catch (IllegalArgumentException e) {
            return Map.of("found", false, "error", String.valueOf(e.getMessage()));
        }
    }

    @Tool(description = "Check which stores hold a document and report any inconsistency")
    public Map<String, Object> sync_validate_consistency(String id) {
        try {
            ConsistencyReport report = coordinator.validateConsistency(id);
            return report.toMap();
        } catch (SyncException e) {
            return error(e);
        }
    }

    @Tool(description = "Tier-aware health report with per-store status, circuit breakers and transaction metrics")
    public Map<String, Object> sync_health() {
        return coordinator.healthStatus();
    }

    @Tool(description = "Find documents semantically similar to a query text")
    public Map<String, Object> sync_search_similar(String query, Integer limit) {
        int k = limit != null && limit > 0 ? limit : 5;
        String text = Objects.toString(query, "");
        return Map.of("query", text, "results", vectorStore.searchSimilar(text, k));
    }

    @Tool(description = "List documents sharing a tag or conversation with the given document")
    public Map<String, Object> sync_related_documents(String id) {
        try {
            return Map.of("docId", id, "related", new ArrayList<>(graphStore.relatedDocuments(id)));
        } catch (RuntimeException e) {
            logger.warn("Related document lookup failed for {}: {}", id, e.getMessage());
            return Map.of("docId", id, "error", String.valueOf(e.getMessage()));
        }
    }

    private DocumentRecord toDocument(String id, String content, List<String> tags,
                                      Map<String, Object> metadata, String conversationId) {
        return DocumentRecord.builder()
                .id(id)
                .content(content)
                .tags(tags)
                .metadata(metadata)
                .conversationId(conversationId)
                .build();
    }

    private Map<String, Object> error(SyncException e) {
        logger.warn("Sync tool call failed ({}): {}", e.getKind(), e.getMessage());
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("success", false);
        error.put("errorKind", e.getKind());
        error.put("error", e.getMessage());
        return error;
    }

    private Map<String, Object> slaExceeded(PerformanceSlaExceededException e) {
        Map<String, Object> error = error(e);
        error.put("measuredTimeMs", e.getMeasuredTimeMs());
        error.put("limitMs", e.getLimitMs());
        List<Object> results = new ArrayList<>();
        for (Object result : e.getResults()) {
            results.add(result instanceof SyncResult ? ((SyncResult) result).toMap() : result);
        }
        error.put("results", results);
        return error;
    }
}
