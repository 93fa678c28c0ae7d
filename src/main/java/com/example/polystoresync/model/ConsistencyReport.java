package com.example.polystoresync.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of a document's presence across all four stores.
 * Equality ignores {@code validatedAt} so two validations with the same findings compare equal.
 */
@Getter
@ToString
@EqualsAndHashCode
public class ConsistencyReport {

    private final String docId;
    private final Map<StoreRole, Boolean> perStoreConsistent = new EnumMap<>(StoreRole.class);
    private final List<String> inconsistencies = new ArrayList<>();
    private final Map<StoreRole, Map<String, Object>> storeStates = new EnumMap<>(StoreRole.class);

    @EqualsAndHashCode.Exclude
    private final Instant validatedAt = Instant.now();

    public ConsistencyReport(String docId) {
        this.docId = docId;
        for (StoreRole role : StoreRole.values()) {
            perStoreConsistent.put(role, false);
        }
    }

    public void markStore(StoreRole role, boolean consistent) {
        perStoreConsistent.put(role, consistent);
    }

    public void addInconsistency(StoreRole role, String description) {
        inconsistencies.add(role == null ? description : "[" + role.getStoreName() + "] " + description);
    }

    public void setStoreState(StoreRole role, Map<String, Object> state) {
        storeStates.put(role, state);
    }

    public boolean isOverallConsistent() {
        return perStoreConsistent.values().stream().allMatch(Boolean::booleanValue);
    }

    public boolean isConsistent(StoreRole role) {
        return perStoreConsistent.getOrDefault(role, false);
    }

    public Map<StoreRole, Boolean> getPerStoreConsistent() {
        return Collections.unmodifiableMap(perStoreConsistent);
    }

    public List<String> getInconsistencies() {
        return Collections.unmodifiableList(inconsistencies);
    }

    public Map<String, Object> toMap() {
        Map<String, Boolean> perStore = new LinkedHashMap<>();
        perStoreConsistent.forEach((role, consistent) -> perStore.put(role.getStoreName(), consistent));

        Map<String, Object> states = new LinkedHashMap<>();
        storeStates.forEach((role, state) -> states.put(role.getStoreName(), state));

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("docId", docId);
        map.put("overallConsistent", isOverallConsistent());
        map.put("perStoreConsistent", perStore);
        map.put("inconsistencies", List.copyOf(inconsistencies));
        map.put("storeStates", states);
        map.put("validatedAt", validatedAt.toString());
        return map;
    }
}
