package com.tollgate.authorizer;

import com.tollgate.authorizer.config.AuthorizerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Tollgate authorizer service.
 *
 * <p>Validates the shared client token presented by callers against the canonical secret held in
 * SSM Parameter Store and answers with an Allow/Deny policy. Exposes:
 *
 * <ul>
 *   <li>{@code POST /api/v1/authorize} for API gateways that call out to a request authorizer
 *   <li>a servlet gate in front of {@code /api/v1/protected/*}
 *   <li>a gRPC server interceptor applying the same decision to gRPC calls
 *   <li>actuator health (with a {@code secretStore} component) and Prometheus metrics
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(AuthorizerProperties.class)
public class AuthorizerServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(AuthorizerServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AuthorizerServiceApplication.class, args);
        log.info("Tollgate authorizer service started");
    }
}
