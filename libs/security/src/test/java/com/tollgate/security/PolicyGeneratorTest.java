package com.tollgate.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PolicyGenerator")
class PolicyGeneratorTest {

    private static final String ARN = "arn:aws:execute-api:us-west-2:123456789012:abc123/prod/GET/orders";

    @Test
    @DisplayName("grants invoke on the requested resource for ALLOW")
    void allowPolicy() {
        var response = PolicyGenerator.generate(AuthorizationDecision.allow("user-0123456789abcdef"), ARN);

        assertThat(response.principalId()).isEqualTo("user-0123456789abcdef");
        assertThat(response.context()).isEqualTo(Map.of("authenticated", "true"));
        assertThat(response.policyDocument().version()).isEqualTo("2012-10-17");
        assertThat(response.policyDocument().statement()).singleElement().satisfies(statement -> {
            assertThat(statement.action()).isEqualTo(List.of("execute-api:Invoke"));
            assertThat(statement.effect()).isEqualTo("Allow");
            assertThat(statement.resource()).isEqualTo(List.of(ARN));
        });
    }

    @Test
    @DisplayName("denies invoke and carries the error type for DENY")
    void denyPolicy() {
        var response = PolicyGenerator.generate(AuthorizationDecision.deny(DenyReason.TOKEN_MISMATCH), ARN);

        assertThat(response.principalId()).isEqualTo("user");
        assertThat(response.context()).isEqualTo(Map.of("errorType", "token_mismatch"));
        assertThat(response.policyDocument().statement().get(0).effect()).isEqualTo("Deny");
    }

    @Test
    @DisplayName("omits the policy when there is no resource")
    void noResource() {
        var allow = AuthorizationDecision.allow("user-0123456789abcdef");

        assertThat(PolicyGenerator.generate(allow, null).policyDocument()).isNull();
        assertThat(PolicyGenerator.generate(allow, " ").policyDocument()).isNull();
    }

    @Test
    @DisplayName("rejects a null decision")
    void rejectsNull() {
        assertThatThrownBy(() -> PolicyGenerator.generate(null, ARN))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
