package com.example.polystoresync.model;

public enum OperationKind {
    CREATE("create"),
    UPDATE("update"),
    DELETE("delete"),
    RETRIEVE("retrieve");

    private final String value;

    OperationKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isWrite() {
        return this != RETRIEVE;
    }
}
