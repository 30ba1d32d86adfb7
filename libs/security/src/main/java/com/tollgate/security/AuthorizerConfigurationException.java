package com.tollgate.security;

/**
 * Thrown at startup when the authorizer cannot be configured, e.g. the secret-store client
 * cannot be constructed. Never raised while serving requests.
 */
public class AuthorizerConfigurationException extends RuntimeException {

    public AuthorizerConfigurationException(String message) {
        super(message);
    }

    public AuthorizerConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
