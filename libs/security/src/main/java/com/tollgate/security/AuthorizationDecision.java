package com.tollgate.security;

import java.util.Map;
import java.util.Optional;

/**
 * Result of authorizing one request.
 * <p>
 * Created fresh per request and immutable. The context never carries the credential or the
 * canonical secret, only the outcome.
 *
 * @param principalId hashed principal id on ALLOW, {@value TokenAuthorizer#ANONYMOUS_PRINCIPAL} on DENY
 * @param effect      ALLOW or DENY
 * @param context     key/value pairs for the router, e.g. {@code errorType} or {@code authenticated}
 */
public record AuthorizationDecision(String principalId, Effect effect, Map<String, String> context) {

    /** Context key carrying the {@link DenyReason} wire value. */
    public static final String ERROR_TYPE = "errorType";

    /** Context key set to {@code "true"} on ALLOW. */
    public static final String AUTHENTICATED = "authenticated";

    public AuthorizationDecision {
        if (principalId == null || principalId.isBlank()) {
            throw new IllegalArgumentException("principalId must not be null or blank");
        }
        if (effect == null) {
            throw new IllegalArgumentException("effect must not be null");
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    /**
     * Creates an ALLOW decision for a validated principal.
     *
     * @param principalId hashed principal id
     */
    public static AuthorizationDecision allow(String principalId) {
        return new AuthorizationDecision(principalId, Effect.ALLOW, Map.of(AUTHENTICATED, "true"));
    }

    /**
     * Creates a DENY decision for the given reason.
     *
     * @param reason why the request was denied
     */
    public static AuthorizationDecision deny(DenyReason reason) {
        return new AuthorizationDecision(TokenAuthorizer.ANONYMOUS_PRINCIPAL, Effect.DENY,
                Map.of(ERROR_TYPE, reason.errorType()));
    }

    public boolean isAllowed() {
        return effect == Effect.ALLOW;
    }

    /** Returns the {@code errorType} context value of a DENY decision. */
    public Optional<String> errorType() {
        return Optional.ofNullable(context.get(ERROR_TYPE));
    }
}
