package com.tollgate.observability;

import java.util.concurrent.CompletableFuture;

/**
 * Probe of one dependency, answered asynchronously so the registry can run probes in parallel
 * and bound each one by a timeout.
 */
@FunctionalInterface
public interface HealthCheck {

    CompletableFuture<ComponentHealth> check();
}
