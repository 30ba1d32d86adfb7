package com.tollgate.security;

/**
 * Outcome of an authorization decision.
 */
public enum Effect {

    ALLOW("Allow"),
    DENY("Deny");

    private final String policyValue;

    Effect(String policyValue) {
        this.policyValue = policyValue;
    }

    /** Value used in IAM-style policy statements ({@code "Allow"} or {@code "Deny"}). */
    public String policyValue() {
        return policyValue;
    }
}
