package com.tollgate.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Thread-local holder for {@link CorrelationContext}, mirrored into SLF4J MDC.
 * <p>
 * Setting a context populates every MDC key; clearing removes them. Work handed to another
 * thread (the secret-fetch pool, for instance) does not inherit the context; wrap it with
 * {@link #callWithContext(CorrelationContext, Supplier)} when that matters.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the context for the current thread and populates MDC.
     *
     * @param context the context to set
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        putMdc(CorrelationContext.MDC_CORRELATION_ID, context.correlationId());
        putMdc(CorrelationContext.MDC_REQUEST_ID, context.requestId());
        putMdc(CorrelationContext.MDC_USER_ID, context.userId());
        putMdc(CorrelationContext.MDC_TRACE_ID, context.traceId());
        putMdc(CorrelationContext.MDC_SPAN_ID, context.spanId());
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Records the principal id of an allowed request on the current context, if there is one.
     *
     * @param principalId hashed principal id
     */
    public static void bindUser(String principalId) {
        get().ifPresent(context -> set(context.withUserId(principalId)));
    }

    /**
     * Clears the context and its MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
        MDC.remove(CorrelationContext.MDC_USER_ID);
        MDC.remove(CorrelationContext.MDC_TRACE_ID);
        MDC.remove(CorrelationContext.MDC_SPAN_ID);
    }

    /**
     * Runs work with the given context, then restores whatever was set before.
     *
     * @param context context for the duration of the work
     * @param work    the work
     * @param <T>     result type
     * @return the work's result
     */
    public static <T> T callWithContext(CorrelationContext context, Supplier<T> work) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            return work.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void putMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
