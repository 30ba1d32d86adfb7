package com.tollgate.observability;

import java.util.Map;

/**
 * Health of a single component.
 *
 * @param name      component name, e.g. {@code secretStore}
 * @param status    component status
 * @param message   optional explanation
 * @param latencyMs time the check took
 * @param details   extra non-sensitive key/value details
 */
public record ComponentHealth(String name, HealthStatus status, String message, long latencyMs,
                              Map<String, Object> details) {

    public ComponentHealth {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static ComponentHealth healthy(String name, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.HEALTHY, null, latencyMs, Map.of());
    }

    public static ComponentHealth degraded(String name, String message, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.DEGRADED, message, latencyMs, Map.of());
    }

    public static ComponentHealth unhealthy(String name, String message, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.UNHEALTHY, message, latencyMs, Map.of());
    }

    /**
     * Returns a copy carrying the given details.
     */
    public ComponentHealth withDetails(Map<String, Object> newDetails) {
        return new ComponentHealth(name, status, message, latencyMs, newDetails);
    }
}
