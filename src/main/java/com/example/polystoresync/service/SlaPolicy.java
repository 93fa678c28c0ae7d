package com.example.polystoresync.service;

import com.example.polystoresync.exception.PerformanceSlaExceededException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Limit table for {@link PerformanceSla}. Measurement is post hoc: a slow call is never aborted,
 * it produces a violation carrying the measured time and the limit.
 */
public class SlaPolicy {

    private final Map<PerformanceSla, Long> limits = new EnumMap<>(PerformanceSla.class);

    public SlaPolicy() {
        this(Map.of());
    }

    public SlaPolicy(Map<PerformanceSla, Long> overrides) {
        for (PerformanceSla sla : PerformanceSla.values()) {
            limits.put(sla, overrides.getOrDefault(sla, sla.getDefaultLimitMs()));
        }
    }

    public long limitMs(PerformanceSla sla) {
        return limits.get(sla);
    }

    public Map<PerformanceSla, Long> getLimits() {
        return Collections.unmodifiableMap(limits);
    }

    public Optional<PerformanceSlaExceededException> check(PerformanceSla sla, String operation,
                                                           double measuredMs, List<?> results) {
        long limit = limitMs(sla);
        if (measuredMs > limit) {
            return Optional.of(new PerformanceSlaExceededException(operation, measuredMs, limit, results));
        }
        return Optional.empty();
    }

    public void enforce(PerformanceSla sla, String operation, double measuredMs, List<?> results) {
        Optional<PerformanceSlaExceededException> violation = check(sla, operation, measuredMs, results);
        if (violation.isPresent()) {
            throw violation.get();
        }
    }

    static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
