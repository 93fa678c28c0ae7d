package com.example.polystoresync.service;

import com.example.polystoresync.model.SystemStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
public class SyncHealthMonitor {

    private static final Logger logger = LoggerFactory.getLogger(SyncHealthMonitor.class);

    private final SyncCoordinator coordinator;

    public SyncHealthMonitor(SyncCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    /**
     * Periodic tier-aware health check (every 5 minutes by default)
     */
    @Scheduled(fixedDelayString = "${app.sync.health-check-interval-ms:300000}", initialDelay = 60000L)
    public void scheduledHealthCheck() {
        try {
            Map<String, Object> report = coordinator.healthStatus();
            String status = String.valueOf(report.get("coordinator_status"));

            if (status.startsWith(SystemStatus.CRITICAL_FAILURE.getValue())) {
                logger.error("Sync health check: {} - {}", status, report.get("per_store"));
            } else if (status.startsWith(SystemStatus.DEGRADED.getValue())) {
                logger.warn("Sync health check: {} - {}", status, report.get("circuit_breakers"));
            } else {
                logger.debug("Sync health check passed");
            }
        } catch (Exception e) {
            logger.error("Error during scheduled sync health check", e);
        }
    }
}
