package com.tollgate.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Identifiers attached to one inbound authorization call so that its log lines, spans and
 * metrics can be tied together.
 * <p>
 * Established at the edge (servlet filter or gRPC interceptor) and pushed into SLF4J MDC by
 * {@link CorrelationContextHolder}. The user id is the hashed principal id, set only once a
 * request has been allowed; it is never a raw credential.
 *
 * @param correlationId id of the caller's flow, taken from {@code X-Correlation-ID} or generated
 * @param requestId     id of this call
 * @param userId        hashed principal id after ALLOW, null before that
 * @param traceId       current OpenTelemetry trace id, null when tracing is off
 * @param spanId        current OpenTelemetry span id, null when tracing is off
 */
public record CorrelationContext(
        String correlationId,
        String requestId,
        String userId,
        String traceId,
        String spanId
) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_USER_ID = "userId";
    public static final String MDC_TRACE_ID = "traceId";
    public static final String MDC_SPAN_ID = "spanId";

    /** Longest caller-supplied correlation id that is propagated. */
    public static final int MAX_CORRELATION_ID_LENGTH = 64;

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._:-]+");

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Opens a context for an inbound call, keeping the caller's correlation id only when it is
     * short and made of safe characters. Anything else is replaced by a fresh UUID, since the id
     * is written to logs and echoed in responses.
     * <p>
     * Trace and span ids are taken from the current OpenTelemetry span when there is a valid one.
     *
     * @param callerCorrelationId value of the inbound header or metadata, may be null
     */
    public static CorrelationContext forInboundCall(String callerCorrelationId) {
        String correlationId = isAcceptable(callerCorrelationId)
                ? callerCorrelationId
                : UUID.randomUUID().toString();
        String requestId = UUID.randomUUID().toString();
        SpanContext span = Span.current().getSpanContext();
        if (!span.isValid()) {
            return of(correlationId, requestId);
        }
        return new CorrelationContext(correlationId, requestId, null, span.getTraceId(), span.getSpanId());
    }

    static boolean isAcceptable(String correlationId) {
        return correlationId != null
                && correlationId.length() <= MAX_CORRELATION_ID_LENGTH
                && SAFE_ID.matcher(correlationId).matches();
    }

    /**
     * Creates a context carrying only the correlation and request ids.
     */
    public static CorrelationContext of(String correlationId, String requestId) {
        return new CorrelationContext(correlationId, requestId, null, null, null);
    }

    /**
     * Returns a copy with the given principal id as user id.
     *
     * @param principalId hashed principal id
     */
    public CorrelationContext withUserId(String principalId) {
        return new CorrelationContext(correlationId, requestId, principalId, traceId, spanId);
    }
}
