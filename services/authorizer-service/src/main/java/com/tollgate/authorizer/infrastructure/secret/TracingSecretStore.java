package com.tollgate.authorizer.infrastructure.secret;

import com.tollgate.observability.SpanHelper;
import com.tollgate.security.SecretStore;
import io.opentelemetry.api.trace.SpanKind;
import java.time.Duration;
import java.util.Map;

/**
 * Wraps every store fetch in a CLIENT span named {@value #SPAN_NAME}. The span carries the secret
 * name, never its value.
 */
public final class TracingSecretStore implements SecretStore, AutoCloseable {

    public static final String SPAN_NAME = "secret-store.fetch";

    private final SecretStore delegate;
    private final SpanHelper spanHelper;

    public TracingSecretStore(SecretStore delegate, SpanHelper spanHelper) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate must not be null");
        }
        if (spanHelper == null) {
            throw new IllegalArgumentException("spanHelper must not be null");
        }
        this.delegate = delegate;
        this.spanHelper = spanHelper;
    }

    @Override
    public String fetch(String name, boolean decrypt, Duration timeout) {
        return spanHelper.inSpan(
                SPAN_NAME,
                SpanKind.CLIENT,
                Map.of("secret.name", name, "secret.timeout_ms", String.valueOf(timeout.toMillis())),
                () -> delegate.fetch(name, decrypt, timeout));
    }

    @Override
    public void close() throws Exception {
        if (delegate instanceof AutoCloseable closeable) {
            closeable.close();
        }
    }
}
