package com.example.polystoresync.breaker;

public enum CircuitBreakerState {
    CLOSED("closed"),
    OPEN("open"),
    HALF_OPEN("half_open");

    private final String value;

    CircuitBreakerState(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
