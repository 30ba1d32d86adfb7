package com.tollgate.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Tuning for the authorizer core, independent of how it was loaded.
 * <p>
 * Invalid optional values fall back to their defaults with a warning; a missing secret name is
 * fatal since there is nothing to validate against.
 *
 * @param secretName          name or path of the canonical secret in the store (trimmed)
 * @param cacheTtl            freshness window of the cached secret (default 5 minutes)
 * @param failureThreshold    consecutive failures before the circuit opens (default 3)
 * @param coolDown            time the circuit stays open after the last failure (default 30 s)
 * @param fetchTimeout        upper bound for one store fetch (default 3 s)
 * @param headerName          primary credential header (default {@code X-Client-Token})
 * @param serveStaleOnFailure whether an expired cached secret may be served when the store fails
 */
public record AuthorizerSettings(
        String secretName,
        Duration cacheTtl,
        int failureThreshold,
        Duration coolDown,
        Duration fetchTimeout,
        String headerName,
        boolean serveStaleOnFailure
) {

    private static final Logger log = LoggerFactory.getLogger(AuthorizerSettings.class);

    public static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(300);
    public static final Duration DEFAULT_FETCH_TIMEOUT = Duration.ofSeconds(3);

    public AuthorizerSettings {
        if (secretName == null || secretName.isBlank()) {
            throw new AuthorizerConfigurationException("secretName must not be null or blank");
        }
        secretName = secretName.strip();
        if (!isPositive(cacheTtl)) {
            log.warn("Invalid cache TTL {}, using default {}", cacheTtl, DEFAULT_CACHE_TTL);
            cacheTtl = DEFAULT_CACHE_TTL;
        }
        if (failureThreshold <= 0) {
            log.warn("Invalid failure threshold {}, using default {}", failureThreshold, CircuitBreaker.DEFAULT_THRESHOLD);
            failureThreshold = CircuitBreaker.DEFAULT_THRESHOLD;
        }
        if (!isPositive(coolDown)) {
            log.warn("Invalid cool-down {}, using default {}", coolDown, CircuitBreaker.DEFAULT_COOL_DOWN);
            coolDown = CircuitBreaker.DEFAULT_COOL_DOWN;
        }
        if (!isPositive(fetchTimeout)) {
            log.warn("Invalid fetch timeout {}, using default {}", fetchTimeout, DEFAULT_FETCH_TIMEOUT);
            fetchTimeout = DEFAULT_FETCH_TIMEOUT;
        }
        if (headerName == null || headerName.isBlank()) {
            headerName = CredentialExtractor.DEFAULT_HEADER_NAME;
        }
    }

    /**
     * Settings with every option at its default.
     *
     * @param secretName name of the canonical secret
     */
    public static AuthorizerSettings defaults(String secretName) {
        return new AuthorizerSettings(secretName, DEFAULT_CACHE_TTL, CircuitBreaker.DEFAULT_THRESHOLD,
                CircuitBreaker.DEFAULT_COOL_DOWN, DEFAULT_FETCH_TIMEOUT, CredentialExtractor.DEFAULT_HEADER_NAME,
                true);
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isNegative() && !duration.isZero();
    }
}
