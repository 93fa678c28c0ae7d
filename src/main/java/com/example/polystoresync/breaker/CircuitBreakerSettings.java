package com.example.polystoresync.breaker;

import lombok.Value;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
public class CircuitBreakerSettings {

    public static final int DEFAULT_FAILURE_THRESHOLD = 3;
    public static final Duration DEFAULT_RECOVERY_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_SUCCESS_THRESHOLD = 2;

    int failureThreshold;
    Duration recoveryTimeout;
    int successThreshold;

    public CircuitBreakerSettings(int failureThreshold, Duration recoveryTimeout, int successThreshold) {
        if (failureThreshold < 1 || successThreshold < 1) {
            throw new IllegalArgumentException("Circuit breaker thresholds must be positive");
        }
        if (recoveryTimeout == null || recoveryTimeout.isNegative()) {
            throw new IllegalArgumentException("Circuit breaker recovery timeout must not be negative");
        }
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.successThreshold = successThreshold;
    }

    public static CircuitBreakerSettings defaults() {
        return new CircuitBreakerSettings(DEFAULT_FAILURE_THRESHOLD, DEFAULT_RECOVERY_TIMEOUT, DEFAULT_SUCCESS_THRESHOLD);
    }

    public static CircuitBreakerSettings withRecoveryTimeout(Duration recoveryTimeout) {
        return new CircuitBreakerSettings(DEFAULT_FAILURE_THRESHOLD, recoveryTimeout, DEFAULT_SUCCESS_THRESHOLD);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("failureThreshold", failureThreshold);
        map.put("recoveryTimeoutSec", recoveryTimeout.toSeconds());
        map.put("successThreshold", successThreshold);
        return map;
    }
}
