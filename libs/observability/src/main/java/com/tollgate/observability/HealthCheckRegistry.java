package com.tollgate.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs registered {@link HealthCheck}s concurrently and folds them into one {@link HealthResult}.
 * <p>
 * Each check is bounded by the registry timeout; a check that times out or fails is reported
 * UNHEALTHY instead of blocking the health endpoint.
 */
public final class HealthCheckRegistry {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final Map<String, HealthCheck> checks = new ConcurrentHashMap<>();
    private final Duration timeout;
    private final Clock clock;

    /**
     * @param timeout upper bound for each individual check
     * @param clock   source of result timestamps
     */
    public HealthCheckRegistry(Duration timeout, Clock clock) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.timeout = timeout;
        this.clock = clock;
    }

    /**
     * Registers a check, replacing any check with the same name.
     */
    public void register(String name, HealthCheck check) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        checks.put(name, check);
    }

    /**
     * Runs every check and aggregates the results.
     *
     * @return the worst component status together with each component's result
     */
    public HealthResult checkAll() {
        Map<String, CompletableFuture<ComponentHealth>> futures = new LinkedHashMap<>();
        checks.forEach((name, check) -> futures.put(name, start(name, check)));

        Map<String, ComponentHealth> results = new LinkedHashMap<>();
        HealthStatus overall = HealthStatus.HEALTHY;
        for (Map.Entry<String, CompletableFuture<ComponentHealth>> entry : futures.entrySet()) {
            ComponentHealth result = await(entry.getKey(), entry.getValue());
            results.put(entry.getKey(), result);
            overall = overall.worst(result.status());
        }
        return new HealthResult(overall, results, clock.instant());
    }

    /**
     * Runs a single named check.
     *
     * @throws IllegalArgumentException if no check is registered under the name
     */
    public ComponentHealth check(String name) {
        HealthCheck check = checks.get(name);
        if (check == null) {
            throw new IllegalArgumentException("No health check registered as '%s'".formatted(name));
        }
        return await(name, start(name, check));
    }

    public int size() {
        return checks.size();
    }

    public Duration timeout() {
        return timeout;
    }

    private static CompletableFuture<ComponentHealth> start(String name, HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private ComponentHealth await(String name, CompletableFuture<ComponentHealth> future) {
        try {
            return future.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS).join();
        } catch (RuntimeException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Health check '{}' failed: {}", name, cause.toString());
            return ComponentHealth.unhealthy(name, "Timeout or error: " + cause.getClass().getSimpleName(),
                    timeout.toMillis());
        }
    }
}
