package com.tollgate.security;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Router-facing rendering of an {@link AuthorizationDecision}, in the shape API gateways expect
 * from a custom request authorizer.
 *
 * @param principalId    principal id of the decision
 * @param policyDocument IAM-style policy; null when there is no effect or resource to grant on
 * @param context        decision context
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthorizerResponse(
        @JsonProperty("principalId") String principalId,
        @JsonProperty("policyDocument") PolicyDocument policyDocument,
        @JsonProperty("context") Map<String, String> context
) {

    public AuthorizerResponse {
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    /**
     * Policy document with a fixed language version.
     *
     * @param version   policy language version
     * @param statement statements of the policy
     */
    public record PolicyDocument(
            @JsonProperty("Version") String version,
            @JsonProperty("Statement") List<Statement> statement
    ) {

        public PolicyDocument {
            statement = List.copyOf(statement);
        }
    }

    /**
     * One policy statement.
     *
     * @param action   actions the statement applies to
     * @param effect   {@code "Allow"} or {@code "Deny"}
     * @param resource resources the statement applies to
     */
    public record Statement(
            @JsonProperty("Action") List<String> action,
            @JsonProperty("Effect") String effect,
            @JsonProperty("Resource") List<String> resource
    ) {

        public Statement {
            action = List.copyOf(action);
            resource = List.copyOf(resource);
        }
    }
}
