package com.tollgate.authorizer.api;

import com.tollgate.authorizer.config.AuthorizerProperties;
import com.tollgate.authorizer.service.AuthorizationService;
import com.tollgate.observability.HealthCheckRegistry;
import com.tollgate.observability.HealthResult;
import com.tollgate.security.CachedSecret;
import com.tollgate.security.CircuitBreaker;
import com.tollgate.security.TokenCache;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operational view of the authorizer: overall health, store, breaker and cache state. Never
 * includes the secret.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final String serviceName;
    private final AuthorizerProperties properties;
    private final TokenCache cache;
    private final HealthCheckRegistry healthChecks;
    private final Clock clock;

    public ServiceInfoController(
            @Value("${spring.application.name}") String serviceName,
            AuthorizerProperties properties,
            AuthorizationService authorizationService,
            HealthCheckRegistry healthChecks,
            Clock clock) {
        this.serviceName = serviceName;
        this.properties = properties;
        this.cache = authorizationService.authorizer().cache();
        this.healthChecks = healthChecks;
        this.clock = clock;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        HealthResult health = healthChecks.checkAll();
        CircuitBreaker breaker = cache.breaker();
        CachedSecret snapshot = cache.snapshot();

        Map<String, Object> breakerInfo = new LinkedHashMap<>();
        breakerInfo.put("state", breaker.state().name());
        breakerInfo.put("failureCount", breaker.failureCount());
        breakerInfo.put("threshold", breaker.threshold());
        breakerInfo.put("coolDownSeconds", breaker.coolDown().toSeconds());

        Map<String, Object> cacheInfo = new LinkedHashMap<>();
        cacheInfo.put("secretName", cache.secretName());
        cacheInfo.put("ttlSeconds", cache.ttl().toSeconds());
        cacheInfo.put("cached", snapshot.hasValue());
        cacheInfo.put("fresh", snapshot.isFreshAt(clock.instant()));
        if (snapshot.hasValue()) {
            cacheInfo.put("expiresAt", snapshot.expiresAt().toString());
        }

        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", serviceName);
        info.put("status", health.status().name());
        info.put("impaired", health.impairedComponents());
        info.put("store", properties.store().name().toLowerCase(Locale.ROOT));
        info.put("breaker", breakerInfo);
        info.put("cache", cacheInfo);
        info.put("timestamp", clock.instant().toString());
        return info;
    }
}
