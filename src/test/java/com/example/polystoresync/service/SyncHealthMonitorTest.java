package com.example.polystoresync.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SyncHealthMonitorTest {

    @Mock
    private SyncCoordinator coordinator;

    @Test
    void testScheduledHealthCheck_ReadsReport() {
        // Given
        when(coordinator.healthStatus()).thenReturn(Map.of("coordinator_status", "degraded (1/2 optional failed)"));
        SyncHealthMonitor monitor = new SyncHealthMonitor(coordinator);

        // When
        monitor.scheduledHealthCheck();

        // Then
        verify(coordinator).healthStatus();
    }

    @Test
    void testScheduledHealthCheck_SwallowsReportFailure() {
        // Given
        when(coordinator.healthStatus()).thenThrow(new IllegalStateException("boom"));
        SyncHealthMonitor monitor = new SyncHealthMonitor(coordinator);

        // When / Then
        assertDoesNotThrow(monitor::scheduledHealthCheck);
    }
}
