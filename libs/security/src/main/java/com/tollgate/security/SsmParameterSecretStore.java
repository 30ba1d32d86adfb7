package com.tollgate.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.model.GetParameterRequest;
import software.amazon.awssdk.services.ssm.model.GetParameterResponse;
import software.amazon.awssdk.services.ssm.model.Parameter;

import java.time.Duration;

/**
 * {@link SecretStore} backed by AWS Systems Manager Parameter Store.
 * <p>
 * Reads a single parameter (normally a {@code SecureString}) with decryption. Each call carries
 * an {@code apiCallTimeout} equal to the requested timeout, covering retries inside the SDK.
 */
public final class SsmParameterSecretStore implements SecretStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SsmParameterSecretStore.class);

    private final SsmClient client;

    /**
     * Creates a store over an existing client. The client is closed by {@link #close()}.
     *
     * @param client configured SSM client
     */
    public SsmParameterSecretStore(SsmClient client) {
        if (client == null) {
            throw new IllegalArgumentException("client must not be null");
        }
        this.client = client;
    }

    /**
     * Builds an SSM client for the given region with the default credentials chain.
     *
     * @param region AWS region id, e.g. {@code us-west-2}
     * @return a store backed by the new client
     * @throws AuthorizerConfigurationException if the client cannot be constructed
     */
    public static SsmParameterSecretStore create(String region) {
        if (region == null || region.isBlank()) {
            throw new AuthorizerConfigurationException("AWS region must not be blank");
        }
        try {
            SsmClient client = SsmClient.builder()
                    .region(Region.of(region.strip()))
                    .build();
            log.info("SSM client created for region {}", region);
            return new SsmParameterSecretStore(client);
        } catch (SdkException | IllegalArgumentException e) {
            throw new AuthorizerConfigurationException("Failed to create SSM client for region " + region, e);
        }
    }

    @Override
    public String fetch(String name, boolean decrypt, Duration timeout) {
        GetParameterRequest request = GetParameterRequest.builder()
                .name(name)
                .withDecryption(decrypt)
                .overrideConfiguration(config -> config.apiCallTimeout(timeout))
                .build();
        try {
            GetParameterResponse response = client.getParameter(request);
            Parameter parameter = response.parameter();
            if (parameter == null || parameter.value() == null) {
                return "";
            }
            return parameter.value();
        } catch (SdkException e) {
            throw new SecretStoreUnavailableException(
                    "SSM GetParameter failed for '%s': %s".formatted(name, e.getClass().getSimpleName()), e);
        }
    }

    @Override
    public void close() {
        client.close();
    }
}
