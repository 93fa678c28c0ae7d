package com.example.polystoresync.model;

import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

@Value
public class StoreHealth {

    public static final String HEALTHY = "healthy";
    public static final String UNHEALTHY = "unhealthy";
    public static final String ERROR = "error";
    public static final String NOT_CONFIGURED = "not_configured";

    String status;
    Map<String, Object> detail;

    public static StoreHealth healthy(Map<String, Object> detail) {
        return new StoreHealth(HEALTHY, detail);
    }

    public static StoreHealth unhealthy(String reason) {
        return new StoreHealth(UNHEALTHY, Map.of("reason", reason));
    }

    public static StoreHealth error(Exception e) {
        return new StoreHealth(ERROR, Map.of("error", String.valueOf(e.getMessage())));
    }

    public static StoreHealth notConfigured() {
        return new StoreHealth(NOT_CONFIGURED, Map.of());
    }

    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("status", status);
        map.put("detail", detail);
        return map;
    }
}
