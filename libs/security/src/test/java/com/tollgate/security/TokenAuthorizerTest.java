package com.tollgate.security;

import com.tollgate.security.testing.InMemorySecretStore;
import com.tollgate.security.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("TokenAuthorizer")
class TokenAuthorizerTest {

    private static final String ARN = "arn:aws:execute-api:us-west-2:123456789012:abc123/prod/GET/orders";

    private MutableClock clock;
    private InMemorySecretStore store;
    private TokenAuthorizer authorizer;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        store = new InMemorySecretStore("secret123");
        authorizer = TokenAuthorizer.create(store, AuthorizerSettings.defaults("/tollgate/client-token"), clock);
    }

    private AuthorizationDecision authorize(Map<String, String> headers) {
        return authorizer.authorize(AuthorizationRequest.of(headers, ARN));
    }

    @Nested
    @DisplayName("end-to-end scenarios")
    class Scenarios {

        @Test
        @DisplayName("allows a matching X-Client-Token")
        void allowsClientToken() {
            var decision = authorize(Map.of("X-Client-Token", "secret123"));

            assertThat(decision.effect()).isEqualTo(Effect.ALLOW);
            assertThat(decision.context()).isEqualTo(Map.of("authenticated", "true"));
            assertThat(decision.principalId()).isEqualTo(PrincipalHasher.hash("secret123"));
        }

        @Test
        @DisplayName("denies with missing_token when no credential header is present")
        void deniesWithoutHeaders() {
            var decision = authorize(Map.of("Accept", "application/json"));

            assertThat(decision.effect()).isEqualTo(Effect.DENY);
            assertThat(decision.errorType()).contains("missing_token");
            assertThat(decision.principalId()).isEqualTo(TokenAuthorizer.ANONYMOUS_PRINCIPAL);
            assertThat(store.fetchCount()).isZero();
        }

        @Test
        @DisplayName("allows a matching bearer token")
        void allowsBearer() {
            store.setValue("abc");

            var decision = authorize(Map.of("Authorization", "Bearer abc"));

            assertThat(decision.isAllowed()).isTrue();
            assertThat(decision.principalId()).isEqualTo(PrincipalHasher.hash("abc"));
        }

        @Test
        @DisplayName("denies with missing_token for a bare 'Bearer'")
        void deniesBareBearer() {
            var decision = authorize(Map.of("Authorization", "Bearer"));

            assertThat(decision.errorType()).contains("missing_token");
        }

        @Test
        @DisplayName("keeps allowing from the last good value while the store is down")
        void staleAfterThreeFailures() {
            assertThat(authorize(Map.of("X-Client-Token", "secret123")).isAllowed()).isTrue();
            clock.advance(Duration.ofMinutes(6));
            store.setFailing();

            for (int i = 0; i < 3; i++) {
                assertThat(authorize(Map.of("X-Client-Token", "secret123")).isAllowed()).isTrue();
            }
            assertThat(authorizer.cache().breaker().isOpen()).isTrue();
            int fetches = store.fetchCount();

            assertThat(authorize(Map.of("X-Client-Token", "secret123")).isAllowed()).isTrue();
            assertThat(store.fetchCount()).isEqualTo(fetches);
        }

        @Test
        @DisplayName("recovers once the cool-down has elapsed and the store is healthy")
        void recoversAfterCoolDown() {
            authorize(Map.of("X-Client-Token", "secret123"));
            clock.advance(Duration.ofMinutes(6));
            store.setFailing();
            for (int i = 0; i < 3; i++) {
                authorize(Map.of("X-Client-Token", "secret123"));
            }

            store.setHealthy().setValue("rotated");
            clock.advance(Duration.ofSeconds(31));

            assertThat(authorize(Map.of("X-Client-Token", "rotated")).isAllowed()).isTrue();
            assertThat(authorizer.cache().breaker().failureCount()).isZero();
            assertThat(authorize(Map.of("X-Client-Token", "secret123")).errorType()).contains("token_mismatch");
        }
    }

    @Nested
    @DisplayName("deny branches")
    class DenyBranches {

        @Test
        @DisplayName("denies with token_mismatch for a wrong credential")
        void mismatch() {
            var decision = authorize(Map.of("X-Client-Token", "wrong"));

            assertThat(decision.errorType()).contains("token_mismatch");
        }

        @Test
        @DisplayName("compares exactly, without case folding")
        void caseSensitiveCompare() {
            assertThat(authorize(Map.of("X-Client-Token", "SECRET123")).errorType()).contains("token_mismatch");
        }

        @Test
        @DisplayName("denies with ssm_failure when the store fails and nothing is cached")
        void storeFailureColdCache() {
            store.setFailing();

            var decision = authorize(Map.of("X-Client-Token", "secret123"));

            assertThat(decision.errorType()).contains("ssm_failure");
        }

        @Test
        @DisplayName("still denies when the breaker is open and nothing is cached")
        void openBreakerEmptyCacheDenies() {
            store.setFailing();
            for (int i = 0; i < 3; i++) {
                authorize(Map.of("X-Client-Token", "secret123"));
            }
            assertThat(authorizer.cache().breaker().isOpen()).isTrue();

            var decision = authorize(Map.of("X-Client-Token", "secret123"));

            assertThat(decision.effect()).isEqualTo(Effect.DENY);
            assertThat(decision.errorType()).contains("ssm_failure");
        }

        @Test
        @DisplayName("denies with ssm_failure when the store returns an empty value")
        void emptySecretDenies() {
            store.setValue("   ");

            assertThat(authorize(Map.of("X-Client-Token", "secret123")).errorType()).contains("ssm_failure");
            assertThat(authorizer.cache().breaker().failureCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("never throws, even when the cache fails unexpectedly")
        void neverThrows() {
            TokenCache cache = mock(TokenCache.class);
            when(cache.get(any())).thenThrow(new IllegalStateException("boom"));
            var broken = new TokenAuthorizer(new CredentialExtractor(), cache, Duration.ofSeconds(3), clock);

            var decision = broken.authorize(AuthorizationRequest.of(Map.of("X-Client-Token", "x"), ARN));

            assertThat(decision.errorType()).contains("ssm_failure");
        }
    }

    @Nested
    @DisplayName("deadlines")
    class Deadlines {

        @Test
        @DisplayName("uses the configured fetch timeout without a deadline")
        void noDeadline() {
            assertThat(authorizer.effectiveTimeout(null)).isEqualTo(Duration.ofSeconds(3));
        }

        @Test
        @DisplayName("shortens the fetch timeout to the time left before the deadline")
        void shortensToDeadline() {
            assertThat(authorizer.effectiveTimeout(clock.instant().plusMillis(800)))
                    .isEqualTo(Duration.ofMillis(800));
            assertThat(authorizer.effectiveTimeout(clock.instant().plusSeconds(10)))
                    .isEqualTo(Duration.ofSeconds(3));
        }

        @Test
        @DisplayName("passes the shortened timeout to the store")
        void passesShortenedTimeout() {
            var request = AuthorizationRequest.of(Map.of("X-Client-Token", "secret123"), ARN)
                    .withDeadline(clock.instant().plusMillis(500));

            assertThat(authorizer.authorize(request).isAllowed()).isTrue();
            assertThat(store.lastTimeout()).isEqualTo(Duration.ofMillis(500));
        }

        @Test
        @DisplayName("denies with ssm_failure when the deadline has already passed on a cold cache")
        void expiredDeadline() {
            var request = AuthorizationRequest.of(Map.of("X-Client-Token", "secret123"), ARN)
                    .withDeadline(clock.instant().minusMillis(1));

            assertThat(authorizer.authorize(request).errorType()).contains("ssm_failure");
            assertThat(store.fetchCount()).isZero();
        }

        @Test
        @DisplayName("answers from a fresh cache even after the deadline")
        void freshCacheIgnoresDeadline() {
            authorize(Map.of("X-Client-Token", "secret123"));
            var request = AuthorizationRequest.of(Map.of("X-Client-Token", "secret123"), ARN)
                    .withDeadline(clock.instant().minusMillis(1));

            assertThat(authorizer.authorize(request).isAllowed()).isTrue();
        }
    }
}
