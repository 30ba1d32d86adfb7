package com.tollgate.authorizer.infrastructure.secret;

import com.tollgate.security.AuthorizerConfigurationException;
import com.tollgate.security.SecretStore;
import java.time.Duration;

/**
 * Serves a fixed canonical secret from configuration. For local runs and tests where no parameter
 * store is reachable.
 */
public final class StaticSecretStore implements SecretStore {

    private final String secret;

    public StaticSecretStore(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new AuthorizerConfigurationException(
                    "tollgate.authorizer.static-secret must be set when store=static");
        }
        this.secret = secret;
    }

    @Override
    public String fetch(String name, boolean decrypt, Duration timeout) {
        return secret;
    }

    @Override
    public String toString() {
        return "StaticSecretStore[secret=****]";
    }
}
