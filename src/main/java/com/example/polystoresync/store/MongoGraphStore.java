package com.example.polystoresync.store;

import com.example.polystoresync.model.DocumentRecord;
import com.example.polystoresync.model.StoreHealth;
import com.example.polystoresync.model.StoreRole;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Relationship graph kept as two MongoDB collections: document nodes, and directed edges from a
 * document to its tags ({@code TAGGED_WITH}) and conversation ({@code PART_OF}).
 */
@Component
public class MongoGraphStore implements StoreAdapter {

    private static final Logger logger = LoggerFactory.getLogger(MongoGraphStore.class);

    static final String NODES = "graph_nodes";
    static final String EDGES = "graph_edges";
    static final String TAGGED_WITH = "TAGGED_WITH";
    static final String PART_OF = "PART_OF";

    private final MongoTemplate mongo;

    public MongoGraphStore(MongoTemplate mongo) {
        this.mongo = mongo;
    }

    @Override
    public StoreRole getRole() {
        return StoreRole.GRAPH;
    }

    @Override
    public boolean storeDocument(DocumentRecord document) {
        Document node = new Document("_id", document.getId())
                .append("content", document.getContent())
                .append("tags", document.getTags())
                .append("metadata", new Document(document.getMetadata()))
                .append("conversationId", document.getConversationId())
                .append("createdAt", Date.from(document.getCreatedAt()))
                .append("updatedAt", Date.from(document.getUpdatedAt()));
        mongo.save(node, NODES);

        // Edges are rebuilt from scratch so an update drops relationships to removed tags
        mongo.remove(edgesFrom(document.getId()), EDGES);
        List<Document> edges = new ArrayList<>();
        Date now = new Date();
        for (String tag : document.getTags()) {
            edges.add(edge(document.getId(), TAGGED_WITH, "tag:" + tag, now));
        }
        if (document.getConversationId() != null) {
            edges.add(edge(document.getId(), PART_OF, "conversation:" + document.getConversationId(), now));
        }
        if (!edges.isEmpty()) {
            mongo.insert(edges, EDGES);
        }
        logger.debug("Stored graph node {} with {} relationship(s)", document.getId(), edges.size());
        return true;
    }

    @Override
    public boolean deleteDocument(String docId) {
        mongo.remove(edgesFrom(docId), EDGES);
        mongo.remove(Query.query(Criteria.where("_id").is(docId)), NODES);
        return true;
    }

    @Override
    public boolean documentExists(String docId) {
        return mongo.exists(Query.query(Criteria.where("_id").is(docId)), NODES);
    }

    /**
     * Ids of documents sharing at least one tag with the given document.
     */
    public Set<String> relatedDocuments(String docId) {
        List<String> tagTargets = mongo.find(
                        Query.query(Criteria.where("from").is(docId).and("type").is(TAGGED_WITH)),
                        Document.class, EDGES).stream()
                .map(edge -> edge.getString("to"))
                .collect(Collectors.toList());
        if (tagTargets.isEmpty()) {
            return Set.of();
        }
        return mongo.find(
                        Query.query(Criteria.where("type").is(TAGGED_WITH)
                                .and("to").in(tagTargets)
                                .and("from").ne(docId)),
                        Document.class, EDGES).stream()
                .map(edge -> edge.getString("from"))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @Override
    public StoreHealth healthStatus() {
        try {
            Document ping = mongo.executeCommand("{ ping: 1 }");
            Object ok = ping.get("ok");
            if (!(ok instanceof Number) || ((Number) ok).doubleValue() != 1.0) {
                return StoreHealth.unhealthy("ping returned " + ping.toJson());
            }
            return StoreHealth.healthy(Map.of(
                    "nodes", mongo.count(new Query(), NODES),
                    "edges", mongo.count(new Query(), EDGES)));
        } catch (DataAccessException e) {
            logger.warn("Graph store health check failed: {}", e.getMessage());
            return StoreHealth.error(e);
        }
    }

    private static Query edgesFrom(String docId) {
        return Query.query(Criteria.where("from").is(docId));
    }

    private static Document edge(String from, String type, String to, Date createdAt) {
        return new Document("from", from)
                .append("type", type)
                .append("to", to)
                .append("createdAt", createdAt);
    }
}
