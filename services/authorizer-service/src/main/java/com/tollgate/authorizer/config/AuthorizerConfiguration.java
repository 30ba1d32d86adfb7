package com.tollgate.authorizer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tollgate.authorizer.health.SecretStoreHealthCheck;
import com.tollgate.authorizer.infrastructure.grpc.GrpcAuthorizationInterceptor;
import com.tollgate.authorizer.infrastructure.grpc.GrpcCorrelationInterceptor;
import com.tollgate.authorizer.infrastructure.grpc.GrpcExceptionInterceptor;
import com.tollgate.authorizer.infrastructure.secret.StaticSecretStore;
import com.tollgate.authorizer.infrastructure.secret.TracingSecretStore;
import com.tollgate.authorizer.infrastructure.web.AuthorizationGateFilter;
import com.tollgate.authorizer.service.AuthorizationService;
import com.tollgate.observability.HealthCheckRegistry;
import com.tollgate.observability.MetricFactory;
import com.tollgate.observability.SensitiveDataRedactor;
import com.tollgate.observability.SpanHelper;
import com.tollgate.security.SecretStore;
import com.tollgate.security.SsmParameterSecretStore;
import com.tollgate.security.TimeoutBoundSecretStore;
import com.tollgate.security.TokenAuthorizer;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/**
 * Wires the authorizer core once per process and hands the same instances to every inbound
 * surface.
 *
 * <p>Store chain: {@code TracingSecretStore -> TimeoutBoundSecretStore -> SSM or static}. The span
 * therefore covers the bounded wait, and the hard timeout applies whatever the backing client
 * does.
 */
@Configuration
public class AuthorizerConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AuthorizerConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SpanHelper spanHelper(@Value("${spring.application.name}") String serviceName) {
        return new SpanHelper(GlobalOpenTelemetry.getTracer(serviceName));
    }

    @Bean
    public MetricFactory metricFactory(
            MeterRegistry registry, @Value("${spring.application.name}") String serviceName) {
        return new MetricFactory(registry, serviceName);
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }

    /**
     * Builds the store chain. Fails startup with {@code AuthorizerConfigurationException} if the
     * backing store cannot be created.
     */
    @Bean
    public SecretStore secretStore(AuthorizerProperties properties, SpanHelper spanHelper) {
        SecretStore backing =
                switch (properties.store()) {
                    case SSM -> SsmParameterSecretStore.create(properties.region());
                    case STATIC -> new StaticSecretStore(properties.staticSecret());
                };
        log.info(
                "Secret store: {} (parameter '{}', fetch timeout {})",
                properties.store(),
                properties.secretName(),
                properties.fetchTimeout());
        return new TracingSecretStore(new TimeoutBoundSecretStore(backing), spanHelper);
    }

    @Bean
    public TokenAuthorizer tokenAuthorizer(
            SecretStore secretStore, AuthorizerProperties properties, Clock clock) {
        log.info("Authorizer configured: {}", properties);
        return TokenAuthorizer.create(secretStore, properties.toSettings(), clock);
    }

    @Bean
    public HealthCheckRegistry healthCheckRegistry(
            TokenAuthorizer tokenAuthorizer, AuthorizerProperties properties, Clock clock) {
        // leave room for one bounded fetch inside the probe
        var registry =
                new HealthCheckRegistry(
                        properties.toSettings().fetchTimeout().plus(HealthCheckRegistry.DEFAULT_TIMEOUT),
                        clock);
        registry.register(
                SecretStoreHealthCheck.NAME,
                new SecretStoreHealthCheck(tokenAuthorizer.cache(), clock));
        return registry;
    }

    @Bean
    public FilterRegistrationBean<AuthorizationGateFilter> authorizationGateFilter(
            AuthorizationService authorizationService,
            AuthorizerProperties properties,
            ObjectMapper objectMapper) {
        var registration =
                new FilterRegistrationBean<>(
                        new AuthorizationGateFilter(authorizationService, objectMapper));
        registration.setUrlPatterns(properties.protectedPaths());
        // after CorrelationIdFilter so denials are logged with a correlation id
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
        return registration;
    }

    /*
     * gRPC interceptors for whichever gRPC server the deployment embeds. Calls must pass through
     * correlation first, then exception mapping, then the authorization gate.
     */

    @Bean
    public GrpcCorrelationInterceptor grpcCorrelationInterceptor() {
        return new GrpcCorrelationInterceptor();
    }

    @Bean
    public GrpcExceptionInterceptor grpcExceptionInterceptor() {
        return new GrpcExceptionInterceptor();
    }

    @Bean
    public GrpcAuthorizationInterceptor grpcAuthorizationInterceptor(
            AuthorizationService authorizationService, Clock clock) {
        return new GrpcAuthorizationInterceptor(authorizationService, clock);
    }
}
