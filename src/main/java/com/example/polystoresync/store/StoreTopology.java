package com.example.polystoresync.store;

import com.example.polystoresync.model.StoreRole;

import java.util.Objects;

/**
 * The stores wired into a coordinator, one explicit field per role.
 * Critical stores are mandatory; an optional store may be left unwired, in which case its
 * operations fail and the write degrades.
 */
public class StoreTopology {

    private final CriticalStoreAdapter relational;
    private final CriticalStoreAdapter vector;
    private final StoreAdapter graph;
    private final StoreAdapter cache;

    public StoreTopology(CriticalStoreAdapter relational, CriticalStoreAdapter vector,
                         StoreAdapter graph, StoreAdapter cache) {
        this.relational = Objects.requireNonNull(relational, "relational store is required");
        this.vector = Objects.requireNonNull(vector, "vector store is required");
        this.graph = graph;
        this.cache = cache;
    }

    public CriticalStoreAdapter getRelational() {
        return relational;
    }

    public CriticalStoreAdapter getVector() {
        return vector;
    }

    public StoreAdapter getGraph() {
        return graph;
    }

    public StoreAdapter getCache() {
        return cache;
    }

    /**
     * Adapter for a role, or {@code null} when an optional role is not wired.
     */
    public StoreAdapter adapterFor(StoreRole role) {
        switch (role) {
            case RELATIONAL:
                return relational;
            case VECTOR:
                return vector;
            case GRAPH:
                return graph;
            case CACHE:
                return cache;
            default:
                throw new IllegalArgumentException("Unknown store role: " + role);
        }
    }
}
