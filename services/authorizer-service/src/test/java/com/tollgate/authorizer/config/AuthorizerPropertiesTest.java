package com.tollgate.authorizer.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tollgate.security.AuthorizerConfigurationException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AuthorizerProperties")
class AuthorizerPropertiesTest {

    private static AuthorizerProperties unset() {
        return new AuthorizerProperties(
                null, null, null, null, null, null, null, null, null, null, null);
    }

    @Test
    @DisplayName("applies defaults to unset values")
    void defaults() {
        var props = unset();

        assertThat(props.secretName()).isEqualTo("/tollgate/client-token");
        assertThat(props.cacheTtl()).isEqualTo(Duration.ofSeconds(300));
        assertThat(props.failureThreshold()).isEqualTo(3);
        assertThat(props.coolDown()).isEqualTo(Duration.ofSeconds(30));
        assertThat(props.fetchTimeout()).isEqualTo(Duration.ofSeconds(3));
        assertThat(props.region()).isEqualTo("us-west-2");
        assertThat(props.headerName()).isEqualTo("X-Client-Token");
        assertThat(props.staleOnFailure()).isTrue();
        assertThat(props.store()).isEqualTo(AuthorizerProperties.StoreType.SSM);
        assertThat(props.protectedPaths()).containsExactly("/api/v1/protected/*");
    }

    @Test
    @DisplayName("converts to core settings, falling back on non-positive durations")
    void toSettings() {
        var props =
                new AuthorizerProperties(
                        " /custom/param ",
                        Duration.ZERO,
                        5,
                        Duration.ofSeconds(10),
                        Duration.ofMillis(500),
                        "eu-west-1",
                        "X-Api-Key",
                        false,
                        AuthorizerProperties.StoreType.STATIC,
                        "s",
                        List.of("/internal/*"));

        var settings = props.toSettings();

        assertThat(settings.secretName()).isEqualTo("/custom/param");
        assertThat(settings.cacheTtl()).isEqualTo(Duration.ofSeconds(300));
        assertThat(settings.failureThreshold()).isEqualTo(5);
        assertThat(settings.coolDown()).isEqualTo(Duration.ofSeconds(10));
        assertThat(settings.fetchTimeout()).isEqualTo(Duration.ofMillis(500));
        assertThat(settings.headerName()).isEqualTo("X-Api-Key");
        assertThat(settings.serveStaleOnFailure()).isFalse();
        assertThat(props.protectedPaths()).containsExactly("/internal/*");
    }

    @Test
    @DisplayName("fails conversion for a blank secret name")
    void blankSecretName() {
        var props =
                new AuthorizerProperties(
                        " ", null, null, null, null, null, null, null, null, null, null);

        assertThatThrownBy(props::toSettings).isInstanceOf(AuthorizerConfigurationException.class);
    }

    @Test
    @DisplayName("keeps the static secret out of toString")
    void toStringHidesSecret() {
        var props =
                new AuthorizerProperties(
                        null,
                        null,
                        null,
                        null,
                        null,
                        null,
                        null,
                        null,
                        AuthorizerProperties.StoreType.STATIC,
                        "super-secret",
                        null);

        assertThat(props.toString()).doesNotContain("super-secret").contains("STATIC");
    }
}
