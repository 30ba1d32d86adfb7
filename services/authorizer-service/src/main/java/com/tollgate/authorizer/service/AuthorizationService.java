package com.tollgate.authorizer.service;

import com.tollgate.observability.CorrelationContextHolder;
import com.tollgate.observability.MetricFactory;
import com.tollgate.observability.SensitiveDataRedactor;
import com.tollgate.security.AuthorizationDecision;
import com.tollgate.security.AuthorizationRequest;
import com.tollgate.security.AuthorizerResponse;
import com.tollgate.security.CircuitBreaker;
import com.tollgate.security.PolicyGenerator;
import com.tollgate.security.TokenAuthorizer;
import io.micrometer.core.instrument.Timer;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point shared by every inbound surface (REST endpoint, servlet gate, gRPC interceptor).
 *
 * <p>Delegates the decision to {@link TokenAuthorizer} and adds the service concerns around it:
 * decision and latency metrics, a breaker gauge, the principal id in MDC after Allow, and request
 * headers logged only in redacted form.
 */
@Service
public class AuthorizationService {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationService.class);

    public static final String DECISIONS_METRIC = "tollgate.authorizer.decisions";
    public static final String LATENCY_METRIC = "tollgate.authorizer.latency";
    public static final String BREAKER_OPEN_METRIC = "tollgate.authorizer.breaker.open";

    private final TokenAuthorizer authorizer;
    private final MetricFactory metrics;
    private final SensitiveDataRedactor redactor;
    private final Timer latency;

    public AuthorizationService(
            TokenAuthorizer authorizer, MetricFactory metrics, SensitiveDataRedactor redactor) {
        this.authorizer = authorizer;
        this.metrics = metrics;
        this.redactor = redactor;
        this.latency =
                metrics.timer(LATENCY_METRIC, "Time taken to reach an authorization decision");
        CircuitBreaker breaker = authorizer.cache().breaker();
        metrics.gauge(
                BREAKER_OPEN_METRIC,
                "1 while the secret-store circuit breaker is open",
                () -> breaker.state() == CircuitBreaker.State.OPEN ? 1 : 0);
    }

    /**
     * Decides one request. Never throws.
     *
     * @param request headers, resource and optional deadline
     * @return the decision
     */
    public AuthorizationDecision authorize(AuthorizationRequest request) {
        if (log.isDebugEnabled()) {
            log.debug(
                    "Authorizing {} with headers {}",
                    request.resource(),
                    redactor.redact(request.headers().asMap()));
        }

        Timer.Sample sample = Timer.start(metrics.registry());
        AuthorizationDecision decision = authorizer.authorize(request);
        sample.stop(latency);

        metrics.counter(
                        DECISIONS_METRIC,
                        "Authorization decisions by effect and error type",
                        "effect",
                        decision.effect().name().toLowerCase(Locale.ROOT),
                        "error_type",
                        decision.errorType().orElse("none"))
                .increment();

        if (decision.isAllowed()) {
            CorrelationContextHolder.bindUser(decision.principalId());
        }
        return decision;
    }

    /**
     * Decides one request and renders the policy response for the router.
     *
     * @param request headers, resource and optional deadline
     * @return principal, policy document and context
     */
    public AuthorizerResponse respond(AuthorizationRequest request) {
        return PolicyGenerator.generate(authorize(request), request.resource());
    }

    public TokenAuthorizer authorizer() {
        return authorizer;
    }
}
