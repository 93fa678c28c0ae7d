package com.example.polystoresync.breaker;

import com.example.polystoresync.model.StoreRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Owns exactly one circuit breaker per optional store. Critical stores are never wrapped:
 * they may not be skipped.
 */
public class CircuitBreakerManager {

    private static final Logger logger = LoggerFactory.getLogger(CircuitBreakerManager.class);

    private final Map<StoreRole, CircuitBreaker> circuitBreakers = new EnumMap<>(StoreRole.class);

    public CircuitBreakerManager(Map<StoreRole, CircuitBreakerSettings> settings) {
        this(settings, Clock.systemUTC());
    }

    public CircuitBreakerManager(Map<StoreRole, CircuitBreakerSettings> settings, Clock clock) {
        settings.keySet().stream()
                .filter(StoreRole::isCritical)
                .findAny()
                .ifPresent(role -> {
                    throw new IllegalArgumentException("Critical store " + role.getStoreName()
                            + " cannot be placed behind a circuit breaker");
                });
        for (StoreRole role : StoreRole.optionalRoles()) {
            CircuitBreakerSettings roleSettings = settings.getOrDefault(role, CircuitBreakerSettings.defaults());
            circuitBreakers.put(role, new CircuitBreaker(role.getStoreName(), roleSettings, clock));
            logger.info("Created circuit breaker for {}", role.getStoreName());
        }
    }

    public CircuitBreaker get(StoreRole role) {
        CircuitBreaker breaker = circuitBreakers.get(role);
        if (breaker == null) {
            throw new IllegalArgumentException("No circuit breaker for store " + role.getStoreName());
        }
        return breaker;
    }

    public <T> T execute(StoreRole role, Supplier<T> operation) {
        return get(role).call(operation);
    }

    public Map<StoreRole, CircuitBreaker> getCircuitBreakers() {
        return Collections.unmodifiableMap(circuitBreakers);
    }

    /**
     * Status snapshot of every breaker, keyed by store name.
     */
    public Map<String, Map<String, Object>> getAllStatus() {
        Map<String, Map<String, Object>> status = new LinkedHashMap<>();
        circuitBreakers.forEach((role, breaker) -> status.put(role.getStoreName(), breaker.getStatus()));
        return status;
    }
}
