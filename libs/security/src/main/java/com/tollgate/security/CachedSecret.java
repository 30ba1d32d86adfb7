package com.tollgate.security;

import java.time.Instant;

/**
 * The last canonical secret fetched from the store, paired with its expiry.
 * <p>
 * Replaced as a whole on every refresh so readers always see a value and an expiry from the same
 * write.
 *
 * @param value     the trimmed canonical secret (empty if nothing has been cached yet)
 * @param expiresAt instant after which the value is stale
 */
public record CachedSecret(String value, Instant expiresAt) {

    /** Marker for "nothing cached yet". */
    public static final CachedSecret EMPTY = new CachedSecret("", Instant.EPOCH);

    public CachedSecret {
        if (value == null) {
            value = "";
        }
        if (expiresAt == null) {
            expiresAt = Instant.EPOCH;
        }
    }

    /** Whether a value has ever been cached, fresh or stale. */
    public boolean hasValue() {
        return !value.isEmpty();
    }

    /**
     * Whether the value is authoritative at {@code now} without consulting the store.
     *
     * @param now the current instant
     * @return true if a value is present and {@code now} is before {@link #expiresAt()}
     */
    public boolean isFreshAt(Instant now) {
        return hasValue() && now.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "CachedSecret[present=" + hasValue() + ", expiresAt=" + expiresAt + "]";
    }
}
