package com.tollgate.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Caches the canonical secret and refreshes it from the {@link SecretStore} when it expires.
 * <p>
 * Read path: a read lock guards a single {@link CachedSecret} reference, so value and expiry are
 * always observed together. A fresh value is returned without touching the store.
 * <p>
 * Refresh path, taken on a miss or expiry:
 * <ol>
 *   <li>If the {@link CircuitBreaker} is open, serve the last value even if expired; fail only when
 *       nothing was ever cached.</li>
 *   <li>Otherwise serialize refreshers on a separate refresh lock, acquired within the fetch
 *       timeout. Waiters re-check freshness after acquiring it, so concurrent misses produce one
 *       store call.</li>
 *   <li>A successful fetch is trimmed, rejected if empty, stored with {@code now + ttl} and resets
 *       the breaker. A failed fetch is recorded on the breaker and falls back to the stale value.</li>
 * </ol>
 * The read/write lock is held only to swap or read the pair, never across the store call, so
 * readers of a fresh value are not blocked by a slow store.
 * <p>
 * Expiry is evaluated lazily on read; nothing is evicted in the background.
 */
public final class TokenCache {

    private static final Logger log = LoggerFactory.getLogger(TokenCache.class);

    private final SecretStore store;
    private final CircuitBreaker breaker;
    private final String secretName;
    private final Duration ttl;
    private final Duration fetchTimeout;
    private final boolean serveStaleOnFailure;
    private final Clock clock;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ReentrantLock refreshLock = new ReentrantLock();

    private CachedSecret current = CachedSecret.EMPTY;

    /**
     * Creates an empty cache.
     *
     * @param store    where the canonical secret is fetched from
     * @param breaker  breaker gating store calls
     * @param settings secret name, TTL, fetch timeout and stale policy
     * @param clock    time source
     */
    public TokenCache(SecretStore store, CircuitBreaker breaker, AuthorizerSettings settings, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store must not be null");
        }
        if (breaker == null) {
            throw new IllegalArgumentException("breaker must not be null");
        }
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.store = store;
        this.breaker = breaker;
        this.secretName = settings.secretName();
        this.ttl = settings.cacheTtl();
        this.fetchTimeout = settings.fetchTimeout();
        this.serveStaleOnFailure = settings.serveStaleOnFailure();
        this.clock = clock;
    }

    /**
     * Returns the canonical secret using the configured fetch timeout.
     *
     * @return the trimmed canonical secret, possibly stale under store failure
     * @throws SecretStoreUnavailableException if no usable value can be produced
     */
    public String get() {
        return get(fetchTimeout);
    }

    /**
     * Returns the canonical secret, fetching it if the cached value is missing or expired.
     *
     * @param timeout upper bound for a store fetch, typically derived from the caller's deadline
     * @return the trimmed canonical secret, possibly stale under store failure
     * @throws SecretStoreUnavailableException if no usable value can be produced
     */
    public String get(Duration timeout) {
        CachedSecret snapshot = snapshot();
        if (snapshot.isFreshAt(clock.instant())) {
            return snapshot.value();
        }
        return refresh(timeout);
    }

    /**
     * Refreshes the cached secret unless another caller already did, honouring the circuit breaker.
     *
     * @param timeout total budget for waiting on a concurrent refresh plus the store fetch
     * @return the current canonical secret
     * @throws SecretStoreUnavailableException if no usable value can be produced
     */
    public String refresh(Duration timeout) {
        if (breaker.isOpen()) {
            return staleOrFail("circuit breaker open", null);
        }

        long budgetNanos = Math.max(0, timeout.toNanos());
        long startedAt = System.nanoTime();
        boolean acquired;
        try {
            acquired = refreshLock.tryLock(budgetNanos, TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return staleOrFail("interrupted while waiting for refresh", e);
        }
        if (!acquired) {
            return staleOrFail("timed out waiting for concurrent refresh", null);
        }

        try {
            CachedSecret snapshot = snapshot();
            if (snapshot.isFreshAt(clock.instant())) {
                return snapshot.value();
            }
            // the previous holder may have just opened the circuit
            if (breaker.isOpen()) {
                return staleOrFail("circuit breaker open", null);
            }
            // time spent queueing for the lock comes out of the caller's budget
            Duration remaining = Duration.ofNanos(budgetNanos - (System.nanoTime() - startedAt));
            return fetchAndStore(remaining);
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * Returns the cached pair as one consistent snapshot.
     */
    public CachedSecret snapshot() {
        lock.readLock().lock();
        try {
            return current;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Drops the cached value. The next {@link #get()} fetches from the store.
     */
    public void invalidate() {
        replace(CachedSecret.EMPTY);
        log.info("Cached secret '{}' invalidated", secretName);
    }

    /** Returns the breaker gating this cache. */
    public CircuitBreaker breaker() {
        return breaker;
    }

    public String secretName() {
        return secretName;
    }

    public Duration ttl() {
        return ttl;
    }

    void replace(CachedSecret secret) {
        lock.writeLock().lock();
        try {
            current = secret;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private String fetchAndStore(Duration timeout) {
        String value;
        try {
            if (timeout.isNegative() || timeout.isZero()) {
                throw new SecretStoreUnavailableException(
                        "Deadline exceeded before fetching secret '%s'".formatted(secretName));
            }
            String raw = store.fetch(secretName, true, timeout);
            value = raw == null ? "" : raw.strip();
            if (value.isEmpty()) {
                throw new EmptySecretException(secretName);
            }
        } catch (RuntimeException e) {
            SecretStoreUnavailableException failure = e instanceof SecretStoreUnavailableException unavailable
                    ? unavailable
                    : new SecretStoreUnavailableException(
                            "Fetching secret '%s' failed with %s".formatted(secretName, e.getClass().getSimpleName()), e);
            breaker.recordFailure();
            log.warn("Secret store fetch failed (failures: {}): {}", breaker.failureCount(), failure.getMessage());
            return staleOrFail("secret store fetch failed", failure);
        }

        replace(new CachedSecret(value, clock.instant().plus(ttl)));
        breaker.reset();
        log.info("Secret '{}' refreshed from store, cached for {}", secretName, ttl);
        return value;
    }

    private String staleOrFail(String reason, Exception cause) {
        CachedSecret snapshot = snapshot();
        if (serveStaleOnFailure && snapshot.hasValue()) {
            log.warn("Serving stale cached secret '{}' ({})", secretName, reason);
            return snapshot.value();
        }
        if (cause instanceof SecretStoreUnavailableException unavailable) {
            throw unavailable;
        }
        throw new SecretStoreUnavailableException(
                "%s and no cached secret available for '%s'".formatted(reason, secretName), cause);
    }
}
