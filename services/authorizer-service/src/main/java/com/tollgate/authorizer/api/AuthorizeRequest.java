package com.tollgate.authorizer.api;

import jakarta.validation.constraints.Positive;
import java.util.Map;

/**
 * Body of {@code POST /api/v1/authorize}, shaped like the request-authorizer event an API gateway
 * sends.
 *
 * @param headers request headers as received by the gateway, any casing
 * @param methodArn resource being invoked, echoed into the policy
 * @param timeoutMillis optional time budget the caller grants this decision
 */
public record AuthorizeRequest(
        Map<String, String> headers, String methodArn, @Positive Long timeoutMillis) {

    @Override
    public String toString() {
        return "AuthorizeRequest[methodArn=%s, headerNames=%s, timeoutMillis=%s]"
                .formatted(methodArn, headers == null ? "[]" : headers.keySet(), timeoutMillis);
    }
}
