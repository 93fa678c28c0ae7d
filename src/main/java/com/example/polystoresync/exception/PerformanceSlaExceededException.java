package com.example.polystoresync.exception;

import java.util.List;
import java.util.Locale;

/**
 * A unit of work took longer than its latency limit. The outcome of the work, if any,
 * travels with the exception so the caller does not lose it.
 */
public class PerformanceSlaExceededException extends SyncException {

    private final double measuredTimeMs;
    private final long limitMs;
    private final String operation;
    private final transient List<?> results;

    public PerformanceSlaExceededException(String operation, double measuredTimeMs, long limitMs) {
        this(operation, measuredTimeMs, limitMs, List.of());
    }

    public PerformanceSlaExceededException(String operation, double measuredTimeMs, long limitMs, List<?> results) {
        super(String.format(Locale.ROOT, "Operation %s took %.2fms, exceeds %dms SLA", operation, measuredTimeMs, limitMs));
        this.operation = operation;
        this.measuredTimeMs = measuredTimeMs;
        this.limitMs = limitMs;
        this.results = results == null ? List.of() : List.copyOf(results);
    }

    public double getMeasuredTimeMs() {
        return measuredTimeMs;
    }

    public long getLimitMs() {
        return limitMs;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * Results produced by the slow unit of work, in order.
     */
    public List<?> getResults() {
        return results;
    }

    @Override
    public String getKind() {
        return "performance_sla_exceeded";
    }
}
