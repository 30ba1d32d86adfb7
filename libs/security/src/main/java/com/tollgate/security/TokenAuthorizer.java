package com.tollgate.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Validates the presented shared-secret credential and produces an {@link AuthorizationDecision}.
 * <p>
 * Flow: extract credential → fetch canonical secret through the {@link TokenCache} → compare →
 * hash principal on match. Every branch ends in a decision:
 * <ul>
 *   <li>no credential → DENY {@code missing_token}</li>
 *   <li>canonical secret unavailable → DENY {@code ssm_failure}</li>
 *   <li>credential differs → DENY {@code token_mismatch}</li>
 *   <li>credential matches → ALLOW with the hashed principal id</li>
 * </ul>
 * {@link #authorize(AuthorizationRequest)} never throws. Neither the credential nor the canonical
 * secret is ever logged.
 */
public final class TokenAuthorizer {

    private static final Logger log = LoggerFactory.getLogger(TokenAuthorizer.class);

    /** Principal id reported on DENY decisions. */
    public static final String ANONYMOUS_PRINCIPAL = "user";

    private final CredentialExtractor extractor;
    private final TokenCache cache;
    private final Duration fetchTimeout;
    private final Clock clock;

    /**
     * Creates an authorizer.
     *
     * @param extractor    credential extractor
     * @param cache        canonical secret cache
     * @param fetchTimeout upper bound for a store fetch when the caller has no tighter deadline
     * @param clock        time source used to turn caller deadlines into timeouts
     */
    public TokenAuthorizer(CredentialExtractor extractor, TokenCache cache, Duration fetchTimeout, Clock clock) {
        if (extractor == null) {
            throw new IllegalArgumentException("extractor must not be null");
        }
        if (cache == null) {
            throw new IllegalArgumentException("cache must not be null");
        }
        if (fetchTimeout == null || fetchTimeout.isNegative() || fetchTimeout.isZero()) {
            throw new IllegalArgumentException("fetchTimeout must be positive");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.extractor = extractor;
        this.cache = cache;
        this.fetchTimeout = fetchTimeout;
        this.clock = clock;
    }

    /**
     * Wires an authorizer, its cache and breaker from settings.
     *
     * @param store    canonical secret source
     * @param settings authorizer tuning
     * @param clock    time source
     */
    public static TokenAuthorizer create(SecretStore store, AuthorizerSettings settings, Clock clock) {
        var breaker = new CircuitBreaker(settings.failureThreshold(), settings.coolDown(), clock);
        var cache = new TokenCache(store, breaker, settings, clock);
        return new TokenAuthorizer(new CredentialExtractor(settings.headerName()), cache, settings.fetchTimeout(), clock);
    }

    /**
     * Authorizes one request.
     *
     * @param request headers, resource and optional deadline
     * @return the decision; never null
     */
    public AuthorizationDecision authorize(AuthorizationRequest request) {
        try {
            return decide(request);
        } catch (RuntimeException e) {
            // unexpected failure, not a store error: still answer, and answer DENY
            log.error("Authorization error: unexpected failure, denying request", e);
            return AuthorizationDecision.deny(DenyReason.SSM_FAILURE);
        }
    }

    private AuthorizationDecision decide(AuthorizationRequest request) {
        log.debug("Authorizer invoked for resource: {}", request.resource());

        Optional<String> credential = extractor.extract(request.headers());
        if (credential.isEmpty()) {
            log.info("Authorization denied: missing token");
            return AuthorizationDecision.deny(DenyReason.MISSING_TOKEN);
        }

        String expected;
        try {
            expected = cache.get(effectiveTimeout(request.deadline()));
        } catch (SecretStoreUnavailableException e) {
            log.warn("Authorization error: failed to retrieve expected token: {}", e.getMessage());
            return AuthorizationDecision.deny(DenyReason.SSM_FAILURE);
        }

        if (!matches(credential.get(), expected)) {
            log.info("Authorization denied: token mismatch");
            return AuthorizationDecision.deny(DenyReason.TOKEN_MISMATCH);
        }

        String principalId = PrincipalHasher.hash(credential.get());
        log.info("Authorization granted for principal: {}", principalId);
        return AuthorizationDecision.allow(principalId);
    }

    /**
     * Fetch timeout for this request: the configured bound, shortened to the time left before the
     * caller's deadline. May be zero or negative when the deadline has already passed.
     */
    Duration effectiveTimeout(Instant deadline) {
        if (deadline == null) {
            return fetchTimeout;
        }
        Duration remaining = Duration.between(clock.instant(), deadline);
        return remaining.compareTo(fetchTimeout) < 0 ? remaining : fetchTimeout;
    }

    private static boolean matches(String presented, String expected) {
        return MessageDigest.isEqual(
                presented.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8));
    }

    /** Returns the cache backing this authorizer. */
    public TokenCache cache() {
        return cache;
    }
}
