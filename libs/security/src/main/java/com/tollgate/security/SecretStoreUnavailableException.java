package com.tollgate.security;

/**
 * Thrown when the canonical secret cannot be obtained from the secret store.
 * <p>
 * Covers network errors, throttling, timeouts, cancellation and an open circuit with nothing
 * cached. Messages name the secret and the failure, never the secret value.
 */
public class SecretStoreUnavailableException extends RuntimeException {

    public SecretStoreUnavailableException(String message) {
        super(message);
    }

    public SecretStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
