package com.eafix.reentry.application.lifecycle;

import java.util.Map;

/**
 * Point-in-time health of one component.
 */
public record ComponentHealth(
    String component,
    Status status,
    String message,
    Map<String, Object> details
) {
    public enum Status {
        HEALTHY,
        DEGRADED,
        UNHEALTHY
    }

    public ComponentHealth {
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static ComponentHealth healthy(String component, Map<String, Object> details) {
        return new ComponentHealth(component, Status.HEALTHY, "ok", details);
    }

    public static ComponentHealth degraded(String component, String message, Map<String, Object> details) {
        return new ComponentHealth(component, Status.DEGRADED, message, details);
    }

    public static ComponentHealth unhealthy(String component, String message) {
        return new ComponentHealth(component, Status.UNHEALTHY, message, Map.of());
    }

    public boolean isHealthy() {
        return status == Status.HEALTHY;
    }
}
