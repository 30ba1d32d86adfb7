package com.tollgate.observability;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Aggregate of all registered checks.
 *
 * @param status    worst component status, HEALTHY when nothing is registered
 * @param checks    component results by name
 * @param timestamp when the checks ran
 */
public record HealthResult(HealthStatus status, Map<String, ComponentHealth> checks, Instant timestamp) {

    public HealthResult {
        checks = Map.copyOf(checks);
    }

    /**
     * Names of the components currently reporting anything other than HEALTHY, sorted.
     */
    public List<String> impairedComponents() {
        return checks.values().stream()
                .filter(health -> health.status() != HealthStatus.HEALTHY)
                .map(ComponentHealth::name)
                .sorted()
                .toList();
    }
}
