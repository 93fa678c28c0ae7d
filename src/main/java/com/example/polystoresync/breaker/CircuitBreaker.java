package com.example.polystoresync.breaker;

import com.example.polystoresync.exception.CircuitBreakerOpenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-store resilience state machine.
 *
 * <ul>
 *   <li>CLOSED: calls pass through, consecutive failures are counted</li>
 *   <li>OPEN: calls are rejected without reaching the store until the recovery timeout elapses</li>
 *   <li>HALF_OPEN: trial calls decide between closing again and reopening</li>
 * </ul>
 *
 * State evaluation and the wrapped call run under one lock, so concurrent callers of the same
 * store observe transitions atomically.
 */
public class CircuitBreaker {

    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final CircuitBreakerSettings settings;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private final CircuitBreakerMetrics metrics = new CircuitBreakerMetrics();

    public CircuitBreaker(String name, CircuitBreakerSettings settings) {
        this(name, settings, Clock.systemUTC());
    }

    public CircuitBreaker(String name, CircuitBreakerSettings settings, Clock clock) {
        this.name = name;
        this.settings = settings;
        this.clock = clock;
        logger.info("Circuit breaker '{}' initialized - failureThreshold={}, recoveryTimeout={}s, successThreshold={}",
                name, settings.getFailureThreshold(), settings.getRecoveryTimeout().toSeconds(),
                settings.getSuccessThreshold());
    }

    /**
     * Execute an operation through the breaker.
     *
     * @throws CircuitBreakerOpenException when the breaker is open; the operation is not invoked
     * @throws RuntimeException whatever the operation threw, after it was recorded as a failure
     */
    public <T> T call(Supplier<T> operation) {
        lock.lock();
        try {
            checkStateTransition();

            if (state == CircuitBreakerState.OPEN) {
                throw new CircuitBreakerOpenException(name, timeUntilRecovery());
            }

            T result;
            try {
                result = operation.get();
            } catch (RuntimeException e) {
                onFailure(e);
                throw e;
            }
            onSuccess();
            return result;
        } finally {
            lock.unlock();
        }
    }

    private void checkStateTransition() {
        if (state == CircuitBreakerState.OPEN && metrics.getLastFailureTime() != null) {
            Duration sinceFailure = Duration.between(metrics.getLastFailureTime(), clock.instant());
            if (sinceFailure.compareTo(settings.getRecoveryTimeout()) >= 0) {
                state = CircuitBreakerState.HALF_OPEN;
                logger.info("Circuit breaker '{}' transitioning to HALF_OPEN for recovery test", name);
            }
        }
    }

    private void onSuccess() {
        metrics.recordSuccess(clock.instant());
        if (state == CircuitBreakerState.HALF_OPEN
                && metrics.getConsecutiveSuccesses() >= settings.getSuccessThreshold()) {
            int successes = metrics.getConsecutiveSuccesses();
            close();
            logger.info("Circuit breaker '{}' CLOSED after recovery - {} consecutive successes", name, successes);
        }
    }

    private void onFailure(RuntimeException e) {
        metrics.recordFailure(clock.instant());
        if (state == CircuitBreakerState.CLOSED
                && metrics.getConsecutiveFailures() >= settings.getFailureThreshold()) {
            state = CircuitBreakerState.OPEN;
            logger.warn("Circuit breaker '{}' OPENED after {} consecutive failures",
                    name, metrics.getConsecutiveFailures());
        } else if (state == CircuitBreakerState.HALF_OPEN) {
            state = CircuitBreakerState.OPEN;
            logger.warn("Circuit breaker '{}' returned to OPEN during recovery test", name);
        }
        logger.debug("Circuit breaker '{}' operation failed: {}", name, e.getMessage());
    }

    private void close() {
        state = CircuitBreakerState.CLOSED;
        metrics.reset();
    }

    private Duration timeUntilRecovery() {
        if (metrics.getLastFailureTime() == null) {
            return Duration.ZERO;
        }
        Duration elapsed = Duration.between(metrics.getLastFailureTime(), clock.instant());
        Duration remaining = settings.getRecoveryTimeout().minus(elapsed);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerSettings getSettings() {
        return settings;
    }

    public CircuitBreakerState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copy of the current counters.
     */
    public CircuitBreakerMetrics getMetrics() {
        lock.lock();
        try {
            return metrics.copy();
        } finally {
            lock.unlock();
        }
    }

    public Map<String, Object> getStatus() {
        lock.lock();
        try {
            Map<String, Object> status = new LinkedHashMap<>();
            status.put("name", name);
            status.put("state", state.getValue());
            status.put("metrics", metrics.toMap());
            status.put("config", settings.toMap());
            status.put("timeUntilRecoveryTestMs",
                    state == CircuitBreakerState.OPEN ? timeUntilRecovery().toMillis() : null);
            return status;
        } finally {
            lock.unlock();
        }
    }

    public void forceOpen() {
        lock.lock();
        try {
            state = CircuitBreakerState.OPEN;
            metrics.recordFailure(clock.instant());
            logger.warn("Circuit breaker '{}' forced to OPEN state", name);
        } finally {
            lock.unlock();
        }
    }

    public void forceClose() {
        lock.lock();
        try {
            close();
            logger.info("Circuit breaker '{}' forced to CLOSED state", name);
        } finally {
            lock.unlock();
        }
    }
}
