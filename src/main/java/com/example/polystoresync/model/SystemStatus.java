package com.example.polystoresync.model;

public enum SystemStatus {
    HEALTHY("healthy"),
    DEGRADED("degraded"),
    CRITICAL_FAILURE("critical_failure");

    private final String value;

    SystemStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
