package com.tollgate.security;

import java.time.Duration;

/**
 * Source of the canonical secret.
 * <p>
 * Implementations talk to a remote store (see {@link SsmParameterSecretStore}) and may be slow
 * or fail. Every failure, including a timeout, must surface as
 * {@link SecretStoreUnavailableException}; callers feed those into the circuit breaker.
 */
@FunctionalInterface
public interface SecretStore {

    /**
     * Fetches the current value of a secret.
     *
     * @param name    secret name or path
     * @param decrypt whether the store should decrypt the value before returning it
     * @param timeout upper bound for the whole call
     * @return the raw secret value as stored (untrimmed, possibly empty)
     * @throws SecretStoreUnavailableException if the value cannot be obtained within the timeout
     */
    String fetch(String name, boolean decrypt, Duration timeout);
}
