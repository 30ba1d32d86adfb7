package com.tollgate.authorizer.config;

import com.tollgate.security.AuthorizerSettings;
import com.tollgate.security.CircuitBreaker;
import com.tollgate.security.CredentialExtractor;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

/**
 * Authorizer configuration bound from {@code tollgate.authorizer.*}.
 *
 * <p>The YAML maps each property to the environment variable used by existing deployments ({@code
 * CLIENT_TOKEN_PARAM_NAME}, {@code TOKEN_CACHE_TTL_SECONDS}, ...). Durations given as bare numbers
 * are seconds.
 *
 * <p>WHY: Unset values get their defaults in the compact constructor, which runs before Bean
 * Validation. A blank secret name or a negative threshold therefore fails startup, while a
 * non-positive TTL, cool-down or timeout is left to {@link AuthorizerSettings}, which falls back
 * to the default with a warning.
 *
 * @param secretName name of the SSM parameter holding the canonical secret
 * @param cacheTtl how long a fetched secret is served without asking the store again
 * @param failureThreshold consecutive store failures before the circuit opens
 * @param coolDown how long the circuit stays open after the last failure
 * @param fetchTimeout upper bound for one store fetch
 * @param region AWS region of the parameter store
 * @param headerName primary credential header
 * @param staleOnFailure whether an expired secret may be served while the store is failing
 * @param store which secret store backs the cache
 * @param staticSecret canonical secret for the {@code static} store, local runs only
 * @param protectedPaths servlet URL patterns gated by the authorization filter
 */
@ConfigurationProperties(prefix = "tollgate.authorizer")
@Validated
public record AuthorizerProperties(
        @NotBlank String secretName,
        @DurationUnit(ChronoUnit.SECONDS) Duration cacheTtl,
        @Positive Integer failureThreshold,
        @DurationUnit(ChronoUnit.SECONDS) Duration coolDown,
        @DurationUnit(ChronoUnit.SECONDS) Duration fetchTimeout,
        @NotBlank String region,
        String headerName,
        Boolean staleOnFailure,
        StoreType store,
        String staticSecret,
        List<String> protectedPaths) {

    public static final String DEFAULT_SECRET_NAME = "/tollgate/client-token";
    public static final String DEFAULT_REGION = "us-west-2";
    public static final String DEFAULT_PROTECTED_PATH = "/api/v1/protected/*";

    /** Backing store for the canonical secret. */
    public enum StoreType {
        /** AWS Systems Manager Parameter Store. */
        SSM,
        /** Fixed value from {@code static-secret}. */
        STATIC
    }

    public AuthorizerProperties {
        if (secretName == null) {
            secretName = DEFAULT_SECRET_NAME;
        }
        if (cacheTtl == null) {
            cacheTtl = AuthorizerSettings.DEFAULT_CACHE_TTL;
        }
        if (failureThreshold == null) {
            failureThreshold = CircuitBreaker.DEFAULT_THRESHOLD;
        }
        if (coolDown == null) {
            coolDown = CircuitBreaker.DEFAULT_COOL_DOWN;
        }
        if (fetchTimeout == null) {
            fetchTimeout = AuthorizerSettings.DEFAULT_FETCH_TIMEOUT;
        }
        if (region == null) {
            region = DEFAULT_REGION;
        }
        if (headerName == null || headerName.isBlank()) {
            headerName = CredentialExtractor.DEFAULT_HEADER_NAME;
        }
        if (staleOnFailure == null) {
            staleOnFailure = Boolean.TRUE;
        }
        if (store == null) {
            store = StoreType.SSM;
        }
        if (protectedPaths == null || protectedPaths.isEmpty()) {
            protectedPaths = List.of(DEFAULT_PROTECTED_PATH);
        } else {
            protectedPaths = List.copyOf(protectedPaths);
        }
    }

    /** Converts to the settings consumed by the authorizer core. */
    public AuthorizerSettings toSettings() {
        return new AuthorizerSettings(
                secretName,
                cacheTtl,
                failureThreshold,
                coolDown,
                fetchTimeout,
                headerName,
                staleOnFailure);
    }

    @Override
    public String toString() {
        // static-secret stays out of logs and actuator output
        return "AuthorizerProperties[secretName=%s, cacheTtl=%s, failureThreshold=%d, coolDown=%s, fetchTimeout=%s, region=%s, headerName=%s, staleOnFailure=%s, store=%s, protectedPaths=%s]"
                .formatted(
                        secretName,
                        cacheTtl,
                        failureThreshold,
                        coolDown,
                        fetchTimeout,
                        region,
                        headerName,
                        staleOnFailure,
                        store,
                        protectedPaths);
    }
}
