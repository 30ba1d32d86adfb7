package com.tollgate.security;

/**
 * Machine-readable reasons for a denied request, reported as {@code errorType} in the decision
 * context. The wire values are stable; routers and dashboards match on them.
 */
public enum DenyReason {

    /** No credential in the client-token header nor a usable bearer token. */
    MISSING_TOKEN("missing_token"),

    /** The secret store could not supply the canonical secret and nothing was cached. */
    SSM_FAILURE("ssm_failure"),

    /** A credential was presented but does not equal the canonical secret. */
    TOKEN_MISMATCH("token_mismatch");

    private final String errorType;

    DenyReason(String errorType) {
        this.errorType = errorType;
    }

    public String errorType() {
        return errorType;
    }
}
