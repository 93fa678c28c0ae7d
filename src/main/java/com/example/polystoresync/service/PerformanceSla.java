package com.example.polystoresync.service;

/**
 * Named latency limits, in milliseconds.
 */
public enum PerformanceSla {
    SINGLE_OPERATION("single_operation", 500),
    QUERY_OPERATION("query_operation", 2000),
    BATCH_OPERATION("batch_operation", 5000),
    CRITICAL_FAILURE_DETECTION("critical_failure_detection", 500),
    CIRCUIT_BREAKER_SHORT_CIRCUIT("circuit_breaker_short_circuit", 100);

    private final String name;
    private final long defaultLimitMs;

    PerformanceSla(String name, long defaultLimitMs) {
        this.name = name;
        this.defaultLimitMs = defaultLimitMs;
    }

    public String getName() {
        return name;
    }

    public long getDefaultLimitMs() {
        return defaultLimitMs;
    }
}
