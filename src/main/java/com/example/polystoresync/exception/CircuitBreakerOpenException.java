package com.example.polystoresync.exception;

import java.time.Duration;

/**
 * Fail-fast rejection from an open circuit breaker; the wrapped store was not called.
 */
public class CircuitBreakerOpenException extends SyncException {

    private final String storeName;
    private final Duration timeUntilRetry;

    public CircuitBreakerOpenException(String storeName, Duration timeUntilRetry) {
        super("Circuit breaker '" + storeName + "' is OPEN - operation blocked, retry in "
                + timeUntilRetry.toMillis() + "ms");
        this.storeName = storeName;
        this.timeUntilRetry = timeUntilRetry;
    }

    public String getStoreName() {
        return storeName;
    }

    public Duration getTimeUntilRetry() {
        return timeUntilRetry;
    }

    @Override
    public String getKind() {
        return "circuit_breaker_open";
    }
}
