package com.tollgate.security;

import java.time.Instant;
import java.util.Map;

/**
 * One inbound request as seen by the authorizer.
 *
 * @param headers  normalized request headers
 * @param resource resource identifier (e.g. a method ARN), only echoed into the policy
 * @param deadline instant by which the caller needs an answer; null when the caller has none
 */
public record AuthorizationRequest(RequestHeaders headers, String resource, Instant deadline) {

    public AuthorizationRequest {
        if (headers == null) {
            headers = RequestHeaders.empty();
        }
        if (resource == null) {
            resource = "";
        }
    }

    /**
     * Creates a request without a deadline from raw router headers.
     *
     * @param headers  header names to values, any casing
     * @param resource resource identifier
     */
    public static AuthorizationRequest of(Map<String, String> headers, String resource) {
        return new AuthorizationRequest(RequestHeaders.of(headers), resource, null);
    }

    /**
     * Returns a copy bounded by the given deadline.
     *
     * @param deadline instant by which the caller needs an answer
     */
    public AuthorizationRequest withDeadline(Instant deadline) {
        return new AuthorizationRequest(headers, resource, deadline);
    }
}
