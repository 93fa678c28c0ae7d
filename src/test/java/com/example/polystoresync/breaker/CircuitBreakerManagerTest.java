package com.example.polystoresync.breaker;

import com.example.polystoresync.model.StoreRole;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerManagerTest {

    @Test
    void testConstructor_OneBreakerPerOptionalStore() {
        // Given
        Map<StoreRole, CircuitBreakerSettings> settings = Map.of(
                StoreRole.GRAPH, CircuitBreakerSettings.withRecoveryTimeout(Duration.ofSeconds(60)),
                StoreRole.CACHE, CircuitBreakerSettings.withRecoveryTimeout(Duration.ofSeconds(30)));

        // When
        CircuitBreakerManager manager = new CircuitBreakerManager(settings);

        // Then
        assertEquals(2, manager.getCircuitBreakers().size());
        assertEquals(Duration.ofSeconds(60), manager.get(StoreRole.GRAPH).getSettings().getRecoveryTimeout());
        assertEquals(Duration.ofSeconds(30), manager.get(StoreRole.CACHE).getSettings().getRecoveryTimeout());
        assertThrows(IllegalArgumentException.class, () -> manager.get(StoreRole.RELATIONAL));
    }

    @Test
    void testConstructor_RejectsCriticalStoreSettings() {
        Map<StoreRole, CircuitBreakerSettings> settings =
                Map.of(StoreRole.VECTOR, CircuitBreakerSettings.defaults());

        assertThrows(IllegalArgumentException.class, () -> new CircuitBreakerManager(settings));
    }

    @Test
    void testExecute_RoutesThroughStoreBreaker() {
        // Given
        CircuitBreakerManager manager = new CircuitBreakerManager(Map.of());

        // When
        String result = manager.execute(StoreRole.CACHE, () -> "cached");

        // Then
        assertEquals("cached", result);
        assertEquals(1, manager.get(StoreRole.CACHE).getMetrics().getTotalOperations());
        assertEquals(0, manager.get(StoreRole.GRAPH).getMetrics().getTotalOperations());
    }

    @Test
    void testGetAllStatus_KeyedByStoreName() {
        // Given
        CircuitBreakerManager manager = new CircuitBreakerManager(Map.of());
        manager.get(StoreRole.GRAPH).forceOpen();

        // When
        Map<String, Map<String, Object>> status = manager.getAllStatus();

        // Then
        assertEquals("open", status.get("graph").get("state"));
        assertEquals("closed", status.get("cache").get("state"));
    }
}
