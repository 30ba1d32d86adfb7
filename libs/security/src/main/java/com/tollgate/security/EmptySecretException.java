package com.tollgate.security;

/**
 * Thrown when the secret store answers with an empty or all-whitespace value.
 * <p>
 * Treated exactly like any other fetch failure: it counts against the circuit breaker and is
 * never cached.
 */
public class EmptySecretException extends SecretStoreUnavailableException {

    private final String secretName;

    public EmptySecretException(String secretName) {
        super("Secret store returned an empty value for '%s'".formatted(secretName));
        this.secretName = secretName;
    }

    public String secretName() {
        return secretName;
    }
}
