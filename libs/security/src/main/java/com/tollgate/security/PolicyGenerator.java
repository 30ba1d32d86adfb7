package com.tollgate.security;

import java.util.List;

/**
 * Turns an {@link AuthorizationDecision} into an {@link AuthorizerResponse}.
 * <p>
 * The policy grants or denies {@value #INVOKE_ACTION} on exactly the requested resource. When the
 * resource is blank no policy document is emitted, only principal and context.
 */
public final class PolicyGenerator {

    /** Policy language version. */
    public static final String POLICY_VERSION = "2012-10-17";

    /** Action covered by generated statements. */
    public static final String INVOKE_ACTION = "execute-api:Invoke";

    private PolicyGenerator() {
        // utility class
    }

    /**
     * Renders a decision for the given resource.
     *
     * @param decision the authorization decision
     * @param resource resource identifier echoed from the request (may be null or blank)
     * @return the router-facing response
     */
    public static AuthorizerResponse generate(AuthorizationDecision decision, String resource) {
        if (decision == null) {
            throw new IllegalArgumentException("decision must not be null");
        }
        AuthorizerResponse.PolicyDocument policy = null;
        if (resource != null && !resource.isBlank()) {
            var statement = new AuthorizerResponse.Statement(
                    List.of(INVOKE_ACTION), decision.effect().policyValue(), List.of(resource));
            policy = new AuthorizerResponse.PolicyDocument(POLICY_VERSION, List.of(statement));
        }
        return new AuthorizerResponse(decision.principalId(), policy, decision.context());
    }
}
