package com.example.polystoresync.store;

import com.example.polystoresync.model.DocumentRecord;
import com.example.polystoresync.model.StoreHealth;
import com.example.polystoresync.model.StoreRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-process similarity index. Content is embedded with signed feature hashing over lower-cased
 * tokens and L2-normalized, so similarity is a plain dot product.
 */
@Component
public class InMemoryVectorStore implements CriticalStoreAdapter {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryVectorStore.class);

    private final int dimension;
    private final Map<String, IndexedDocument> index = new ConcurrentHashMap<>();

    public InMemoryVectorStore(@Value("${app.vector.dimension:384}") int dimension) {
        if (dimension < 1) {
            throw new IllegalArgumentException("Vector dimension must be positive");
        }
        this.dimension = dimension;
    }

    @Override
    public StoreRole getRole() {
        return StoreRole.VECTOR;
    }

    @Override
    public boolean storeDocument(DocumentRecord document) {
        String text = document.getContent() + " " + String.join(" ", document.getTags());
        index.put(document.getId(), new IndexedDocument(document, embed(text)));
        logger.debug("Indexed vector for document {}", document.getId());
        return true;
    }

    @Override
    public boolean deleteDocument(String docId) {
        index.remove(docId);
        return true;
    }

    @Override
    public boolean documentExists(String docId) {
        return index.containsKey(docId);
    }

    @Override
    public Optional<DocumentRecord> retrieveDocument(String docId) {
        return Optional.ofNullable(index.get(docId)).map(IndexedDocument::document);
    }

    /**
     * Top {@code k} documents by cosine similarity to the query, best first.
     */
    public List<Map<String, Object>> searchSimilar(String query, int k) {
        float[] queryVector = embed(query);
        return index.entrySet().stream()
                .map(e -> Map.entry(e.getKey(), dot(queryVector, e.getValue().vector())))
                .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder()))
                .limit(Math.max(k, 0))
                .map(e -> {
                    Map<String, Object> hit = new LinkedHashMap<>();
                    hit.put("docId", e.getKey());
                    hit.put("score", e.getValue());
                    return hit;
                })
                .collect(Collectors.toList());
    }

    @Override
    public StoreHealth healthStatus() {
        return StoreHealth.healthy(Map.of("vectors", index.size(), "dimension", dimension));
    }

    float[] embed(String text) {
        float[] vector = new float[dimension];
        for (String token : text.toLowerCase(Locale.ROOT).split("\\W+")) {
            if (token.isEmpty()) {
                continue;
            }
            int hash = token.hashCode();
            int slot = Math.floorMod(hash, dimension);
            vector[slot] += (hash & 0x10000) == 0 ? 1f : -1f;
        }
        double norm = 0;
        for (float v : vector) {
            norm += v * v;
        }
        if (norm > 0) {
            float scale = (float) (1.0 / Math.sqrt(norm));
            for (int i = 0; i < vector.length; i++) {
                vector[i] *= scale;
            }
        }
        return vector;
    }

    private static double dot(float[] a, float[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    private static final class IndexedDocument {
        private final DocumentRecord document;
        private final float[] vector;

        private IndexedDocument(DocumentRecord document, float[] vector) {
            this.document = document;
            this.vector = vector;
        }

        DocumentRecord document() {
            return document;
        }

        float[] vector() {
            return vector;
        }
    }
}
