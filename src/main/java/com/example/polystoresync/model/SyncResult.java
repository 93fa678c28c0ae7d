package com.example.polystoresync.model;

import com.example.polystoresync.exception.PerformanceSlaExceededException;
import com.example.polystoresync.exception.SyncException;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Caller-facing outcome of a synchronized write.
 * {@code systemStatus} always tells healthy, degraded and critical failure apart.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class SyncResult {

    private final boolean success;
    private final String docId;
    private final String transactionId;
    private final double executionTimeMs;

    @Builder.Default
    private final List<StoreRole> affectedStores = List.of();

    @Builder.Default
    private final SystemStatus systemStatus = SystemStatus.HEALTHY;

    @Builder.Default
    private final List<StoreRole> degradedStores = List.of();

    @Builder.Default
    private final Map<StoreRole, String> functionalityImpact = new EnumMap<>(StoreRole.class);

    private final ConsistencyReport consistencyReport;
    private final String error;
    private final SyncException failure;
    private final boolean rollbackAttempted;
    private final boolean rollbackSucceeded;

    @Builder.Default
    private final List<PerformanceSlaExceededException> slaViolations = List.of();

    @Builder.Default
    private final Instant timestamp = Instant.now();

    public boolean isDegraded() {
        return systemStatus == SystemStatus.DEGRADED;
    }

    public List<String> degradedStoreNames() {
        return degradedStores.stream().map(StoreRole::getStoreName).collect(Collectors.toList());
    }

    public Map<String, Object> toMap() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", success);
        result.put("docId", docId);
        result.put("transactionId", transactionId);
        result.put("executionTimeMs", executionTimeMs);
        result.put("affectedStores", affectedStores.stream().map(StoreRole::getStoreName).collect(Collectors.toList()));
        result.put("systemStatus", systemStatus.getValue());
        result.put("degradedStores", degradedStoreNames());

        Map<String, String> impact = new LinkedHashMap<>();
        functionalityImpact.forEach((role, text) -> impact.put(role.getStoreName(), text));
        result.put("functionalityImpact", impact);

        if (consistencyReport != null) {
            result.put("consistencyReport", consistencyReport.toMap());
        }
        if (error != null) {
            result.put("error", error);
        }
        if (failure != null) {
            result.put("errorKind", failure.getKind());
        }
        if (rollbackAttempted) {
            result.put("rollbackAttempted", true);
            result.put("rollbackSucceeded", rollbackSucceeded);
        }
        if (!slaViolations.isEmpty()) {
            result.put("slaViolations", slaViolations.stream()
                    .map(PerformanceSlaExceededException::getMessage)
                    .collect(Collectors.toList()));
        }
        result.put("timestamp", timestamp.toString());
        return result;
    }
}
