package com.example.polystoresync.breaker;

import lombok.Getter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Call outcome counters for one breaker. Mutated only by the owning breaker, under its lock.
 */
@Getter
public class CircuitBreakerMetrics {

    private int failureCount;
    private int successCount;
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    private long totalOperations;
    private Instant lastFailureTime;
    private Instant lastSuccessTime;

    void recordSuccess(Instant now) {
        successCount++;
        consecutiveSuccesses++;
        consecutiveFailures = 0;
        lastSuccessTime = now;
        totalOperations++;
    }

    void recordFailure(Instant now) {
        failureCount++;
        consecutiveFailures++;
        consecutiveSuccesses = 0;
        lastFailureTime = now;
        totalOperations++;
    }

    void reset() {
        failureCount = 0;
        successCount = 0;
        consecutiveFailures = 0;
        consecutiveSuccesses = 0;
        totalOperations = 0;
    }

    CircuitBreakerMetrics copy() {
        CircuitBreakerMetrics copy = new CircuitBreakerMetrics();
        copy.failureCount = failureCount;
        copy.successCount = successCount;
        copy.consecutiveFailures = consecutiveFailures;
        copy.consecutiveSuccesses = consecutiveSuccesses;
        copy.totalOperations = totalOperations;
        copy.lastFailureTime = lastFailureTime;
        copy.lastSuccessTime = lastSuccessTime;
        return copy;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("failureCount", failureCount);
        map.put("successCount", successCount);
        map.put("consecutiveFailures", consecutiveFailures);
        map.put("consecutiveSuccesses", consecutiveSuccesses);
        map.put("totalOperations", totalOperations);
        map.put("lastFailureTime", lastFailureTime == null ? null : lastFailureTime.toString());
        map.put("lastSuccessTime", lastSuccessTime == null ? null : lastSuccessTime.toString());
        return map;
    }
}
