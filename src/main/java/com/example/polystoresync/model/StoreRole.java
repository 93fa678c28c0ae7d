package com.example.polystoresync.model;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The four stores a document is written to, each with a fixed priority.
 * Critical roles are declared in the order the critical phase executes them.
 */
public enum StoreRole {

    RELATIONAL("relational", Priority.CRITICAL, "document lookup and metadata queries unavailable"),
    VECTOR("vector", Priority.CRITICAL, "semantic search unavailable"),
    GRAPH("graph", Priority.OPTIONAL, "relationship queries unavailable"),
    CACHE("cache", Priority.OPTIONAL, "low-latency cached reads unavailable; reads served from the relational store");

    public enum Priority {
        CRITICAL,
        OPTIONAL
    }

    private final String storeName;
    private final Priority priority;
    private final String functionalityImpact;

    StoreRole(String storeName, Priority priority, String functionalityImpact) {
        this.storeName = storeName;
        this.priority = priority;
        this.functionalityImpact = functionalityImpact;
    }

    public String getStoreName() {
        return storeName;
    }

    public Priority getPriority() {
        return priority;
    }

    public String getFunctionalityImpact() {
        return functionalityImpact;
    }

    public boolean isCritical() {
        return priority == Priority.CRITICAL;
    }

    public static List<StoreRole> criticalRoles() {
        return Arrays.stream(values()).filter(StoreRole::isCritical).collect(Collectors.toList());
    }

    public static List<StoreRole> optionalRoles() {
        return Arrays.stream(values()).filter(role -> !role.isCritical()).collect(Collectors.toList());
    }
}
