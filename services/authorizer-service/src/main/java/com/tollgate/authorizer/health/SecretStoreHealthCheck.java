package com.tollgate.authorizer.health;

import com.tollgate.observability.ComponentHealth;
import com.tollgate.observability.HealthCheck;
import com.tollgate.security.CachedSecret;
import com.tollgate.security.CircuitBreaker;
import com.tollgate.security.SecretStoreUnavailableException;
import com.tollgate.security.TokenCache;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Reports whether the authorizer can currently obtain the canonical secret.
 *
 * <ul>
 *   <li>HEALTHY: a fresh secret is cached, or a refresh just succeeded
 *   <li>DEGRADED: only a stale secret is available (store failing or circuit open)
 *   <li>UNHEALTHY: no secret at all, so every request would be denied
 * </ul>
 *
 * A probe with no fresh value goes through the cache, so it counts toward the breaker like any
 * request would.
 */
public final class SecretStoreHealthCheck implements HealthCheck {

    public static final String NAME = "secretStore";

    private final TokenCache cache;
    private final Clock clock;

    public SecretStoreHealthCheck(TokenCache cache, Clock clock) {
        this.cache = cache;
        this.clock = clock;
    }

    @Override
    public CompletableFuture<ComponentHealth> check() {
        return CompletableFuture.supplyAsync(this::probe);
    }

    ComponentHealth probe() {
        long start = clock.millis();
        String failure = null;
        if (!cache.snapshot().isFreshAt(clock.instant())) {
            try {
                cache.get();
            } catch (SecretStoreUnavailableException e) {
                failure = e.getMessage();
            }
        }
        long latencyMs = clock.millis() - start;
        CachedSecret snapshot = cache.snapshot();

        ComponentHealth health;
        if (snapshot.isFreshAt(clock.instant())) {
            health = ComponentHealth.healthy(NAME, latencyMs);
        } else if (snapshot.hasValue()) {
            health = ComponentHealth.degraded(NAME, "Serving stale cached secret", latencyMs);
        } else {
            health =
                    ComponentHealth.unhealthy(
                            NAME, failure != null ? failure : "No secret available", latencyMs);
        }
        return health.withDetails(details(snapshot));
    }

    private Map<String, Object> details(CachedSecret snapshot) {
        CircuitBreaker breaker = cache.breaker();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("secretName", cache.secretName());
        details.put("breaker", breaker.state().name());
        details.put("failureCount", breaker.failureCount());
        details.put("cached", snapshot.hasValue());
        if (snapshot.hasValue()) {
            details.put("expiresAt", snapshot.expiresAt().toString());
        }
        return details;
    }
}
