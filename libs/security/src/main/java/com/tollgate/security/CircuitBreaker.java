package com.tollgate.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Tracks consecutive secret-store failures and short-circuits fetches while the store is down.
 * <p>
 * State transitions are evaluated lazily from {@code (failureCount, lastFailureAt, now)}:
 * <ul>
 *   <li>CLOSED → OPEN once {@code failureCount >= threshold}</li>
 *   <li>OPEN → CLOSED on the first {@link #isOpen()} call after {@code coolDown} has elapsed since
 *       the last failure; the failure count is reset exactly once</li>
 *   <li>any state → CLOSED on {@link #reset()} (called after a successful fetch)</li>
 * </ul>
 * There is no timer thread. After the cool-down the count starts again from zero, so the circuit
 * re-opens only after another {@code threshold} consecutive failures.
 * <p>
 * Thread-safe: guarded by a read/write lock.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    /** Default number of consecutive failures before the circuit opens. */
    public static final int DEFAULT_THRESHOLD = 3;

    /** Default time the circuit stays open after the last failure. */
    public static final Duration DEFAULT_COOL_DOWN = Duration.ofSeconds(30);

    /** Externally visible breaker state. */
    public enum State {
        CLOSED,
        OPEN
    }

    private final int threshold;
    private final Duration coolDown;
    private final Clock clock;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private int failureCount;
    private Instant lastFailureAt = Instant.EPOCH;

    /**
     * Creates a breaker with the default threshold and cool-down on the system clock.
     */
    public CircuitBreaker() {
        this(DEFAULT_THRESHOLD, DEFAULT_COOL_DOWN, Clock.systemUTC());
    }

    /**
     * Creates a breaker.
     *
     * @param threshold consecutive failures that open the circuit (must be positive)
     * @param coolDown  how long the circuit stays open after the last failure (must be positive)
     * @param clock     time source
     */
    public CircuitBreaker(int threshold, Duration coolDown, Clock clock) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be positive");
        }
        if (coolDown == null || coolDown.isNegative() || coolDown.isZero()) {
            throw new IllegalArgumentException("coolDown must be positive");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.threshold = threshold;
        this.coolDown = coolDown;
        this.clock = clock;
    }

    /**
     * Returns whether store calls should currently be skipped.
     * <p>
     * Fast path under the read lock. When the cool-down has elapsed the write lock is taken and
     * the condition re-validated before resetting, so a failure recorded concurrently during the
     * lock upgrade keeps the circuit open.
     */
    public boolean isOpen() {
        Instant lastFailure;
        lock.readLock().lock();
        try {
            if (failureCount < threshold) {
                return false;
            }
            lastFailure = lastFailureAt;
        } finally {
            lock.readLock().unlock();
        }

        if (withinCoolDown(lastFailure, clock.instant())) {
            return true;
        }

        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            if (failureCount >= threshold) {
                if (withinCoolDown(lastFailureAt, now)) {
                    return true;
                }
                failureCount = 0;
                log.info("Circuit breaker CLOSED after cool-down of {}", coolDown);
            }
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Records a failed store fetch. Logs only when this failure opens the circuit.
     */
    public void recordFailure() {
        lock.writeLock().lock();
        try {
            boolean wasOpen = failureCount >= threshold;
            failureCount++;
            lastFailureAt = clock.instant();
            if (!wasOpen && failureCount >= threshold) {
                log.warn("Circuit breaker OPENED after {} consecutive failures", failureCount);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Clears the failure count. Called after every successful store fetch.
     */
    public void reset() {
        lock.writeLock().lock();
        try {
            if (failureCount > 0) {
                log.info("Circuit breaker CLOSED (reset from {} failures)", failureCount);
            }
            failureCount = 0;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Returns the current consecutive failure count. */
    public int failureCount() {
        lock.readLock().lock();
        try {
            return failureCount;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the state as it would be reported by {@link #isOpen()}, without triggering the
     * cool-down reset.
     */
    public State state() {
        lock.readLock().lock();
        try {
            boolean open = failureCount >= threshold && withinCoolDown(lastFailureAt, clock.instant());
            return open ? State.OPEN : State.CLOSED;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int threshold() {
        return threshold;
    }

    public Duration coolDown() {
        return coolDown;
    }

    private boolean withinCoolDown(Instant lastFailure, Instant now) {
        return Duration.between(lastFailure, now).compareTo(coolDown) < 0;
    }
}
