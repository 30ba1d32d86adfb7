package com.tollgate.security;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.model.GetParameterRequest;
import software.amazon.awssdk.services.ssm.model.GetParameterResponse;
import software.amazon.awssdk.services.ssm.model.Parameter;
import software.amazon.awssdk.services.ssm.model.ParameterNotFoundException;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("SsmParameterSecretStore")
class SsmParameterSecretStoreTest {

    private SsmClient client;
    private SsmParameterSecretStore store;

    @BeforeEach
    void setUp() {
        client = mock(SsmClient.class);
        store = new SsmParameterSecretStore(client);
    }

    private static GetParameterResponse responseWith(String value) {
        return GetParameterResponse.builder()
                .parameter(Parameter.builder().name("/tollgate/client-token").value(value).build())
                .build();
    }

    @Test
    @DisplayName("reads the parameter with decryption and a per-call timeout")
    void readsParameter() {
        when(client.getParameter(any(GetParameterRequest.class))).thenReturn(responseWith("secret123"));

        String value = store.fetch("/tollgate/client-token", true, Duration.ofSeconds(3));

        ArgumentCaptor<GetParameterRequest> captor = ArgumentCaptor.forClass(GetParameterRequest.class);
        verify(client).getParameter(captor.capture());
        GetParameterRequest request = captor.getValue();
        assertThat(value).isEqualTo("secret123");
        assertThat(request.name()).isEqualTo("/tollgate/client-token");
        assertThat(request.withDecryption()).isTrue();
        assertThat(request.overrideConfiguration())
                .hasValueSatisfying(config -> assertThat(config.apiCallTimeout()).contains(Duration.ofSeconds(3)));
    }

    @Test
    @DisplayName("returns an empty string when the parameter has no value")
    void missingValue() {
        when(client.getParameter(any(GetParameterRequest.class)))
                .thenReturn(GetParameterResponse.builder().build());

        assertThat(store.fetch("/tollgate/client-token", true, Duration.ofSeconds(3))).isEmpty();
    }

    @Test
    @DisplayName("maps service errors to SecretStoreUnavailableException")
    void mapsServiceErrors() {
        when(client.getParameter(any(GetParameterRequest.class)))
                .thenThrow(ParameterNotFoundException.builder().message("not found").build());

        assertThatThrownBy(() -> store.fetch("/tollgate/client-token", true, Duration.ofSeconds(3)))
                .isInstanceOf(SecretStoreUnavailableException.class)
                .hasMessageContaining("ParameterNotFoundException")
                .hasMessageContaining("/tollgate/client-token");
    }

    @Test
    @DisplayName("maps client errors to SecretStoreUnavailableException")
    void mapsClientErrors() {
        when(client.getParameter(any(GetParameterRequest.class)))
                .thenThrow(SdkClientException.create("unable to load credentials"));

        assertThatThrownBy(() -> store.fetch("/tollgate/client-token", true, Duration.ofSeconds(3)))
                .isInstanceOf(SecretStoreUnavailableException.class)
                .hasCauseInstanceOf(SdkClientException.class);
    }

    @Test
    @DisplayName("closes the client")
    void closesClient() {
        store.close();
        verify(client).close();
    }

    @Test
    @DisplayName("rejects a blank region")
    void rejectsBlankRegion() {
        assertThatThrownBy(() -> SsmParameterSecretStore.create(" "))
                .isInstanceOf(AuthorizerConfigurationException.class);
    }
}
