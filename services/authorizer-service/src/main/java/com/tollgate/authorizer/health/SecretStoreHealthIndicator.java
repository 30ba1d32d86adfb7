package com.tollgate.authorizer.health;

import com.tollgate.observability.ComponentHealth;
import com.tollgate.observability.HealthCheckRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * Publishes the {@link SecretStoreHealthCheck} result as the actuator {@code secretStore}
 * component.
 *
 * <p>DEGRADED maps to a custom {@code DEGRADED} status, ordered between DOWN and UP in {@code
 * application.yml}, so a stale-but-serving authorizer does not fail readiness.
 */
@Component(SecretStoreHealthCheck.NAME)
public class SecretStoreHealthIndicator implements HealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED");

    private final HealthCheckRegistry registry;

    public SecretStoreHealthIndicator(HealthCheckRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        ComponentHealth result = registry.check(SecretStoreHealthCheck.NAME);
        Status status =
                switch (result.status()) {
                    case HEALTHY -> Status.UP;
                    case DEGRADED -> DEGRADED;
                    case UNHEALTHY -> Status.DOWN;
                };
        Health.Builder builder = Health.status(status).withDetails(result.details());
        builder.withDetail("latencyMs", result.latencyMs());
        if (result.message() != null) {
            builder.withDetail("message", result.message());
        }
        return builder.build();
    }
}
