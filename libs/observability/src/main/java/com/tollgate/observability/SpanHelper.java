package com.tollgate.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper over an OpenTelemetry {@link Tracer} that stamps the current
 * {@link CorrelationContext} onto every span it opens.
 * <p>
 * Does not configure the SDK. Without an exporter the no-op tracer is used and spans cost
 * next to nothing.
 */
public final class SpanHelper {

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs work inside a span of the given kind. The span ends when the work returns or throws;
     * a runtime exception marks it as ERROR, is recorded on it and is rethrown unchanged.
     *
     * @param spanName   span name
     * @param kind       span kind, CLIENT for outbound calls
     * @param attributes extra string attributes
     * @param work       the work
     * @param <T>        result type
     * @return the work's result
     */
    public <T> T inSpan(String spanName, SpanKind kind, Map<String, String> attributes, Supplier<T> work) {
        var builder = tracer.spanBuilder(spanName).setSpanKind(kind);
        attributes.forEach(builder::setAttribute);
        Span span = builder.startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute("correlation.id", ctx.correlationId());
            if (ctx.userId() != null) {
                span.setAttribute("enduser.id", ctx.userId());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getClass().getSimpleName());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
