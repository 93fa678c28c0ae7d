package com.example.polystoresync.controller;

import com.example.polystoresync.model.SystemStatus;
import com.example.polystoresync.service.SyncCoordinator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final SyncCoordinator coordinator;

    public HealthController(SyncCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    /**
     * 200 while the critical tier is up (healthy or degraded), 503 once a critical store fails.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("service", "polystore-sync");
        health.put("version", "0.1.0");

        Map<String, Object> report;
        try {
            report = coordinator.healthStatus();
        } catch (Exception e) {
            health.put("status", "DOWN");
            health.put("error", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(health);
        }

        String coordinatorStatus = String.valueOf(report.get("coordinator_status"));
        boolean critical = coordinatorStatus.startsWith(SystemStatus.CRITICAL_FAILURE.getValue());
        health.put("status", critical ? "DOWN" : "UP");
        health.putAll(report);

        if (critical) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(health);
        }
        return ResponseEntity.ok(health);
    }

    @GetMapping("/actuator/health")
    public ResponseEntity<Map<String, Object>> actuatorHealth() {
        return health();
    }
}
