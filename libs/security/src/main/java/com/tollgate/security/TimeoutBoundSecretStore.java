package com.tollgate.security;

import com.tollgate.observability.CorrelationContext;
import com.tollgate.observability.CorrelationContextHolder;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decorator that enforces the fetch timeout regardless of how the wrapped store behaves.
 * <p>
 * The delegate runs on a worker thread; the caller waits at most {@code timeout}. On timeout or
 * interruption the worker is cancelled (interrupted) and the caller gets a
 * {@link SecretStoreUnavailableException}, so a hung store counts as a failure for the circuit
 * breaker instead of stalling the request.
 * <p>
 * The caller's {@link CorrelationContext}, if any, is carried onto the worker for the duration
 * of the fetch, so the delegate's log lines keep the request's correlation id.
 */
public final class TimeoutBoundSecretStore implements SecretStore, AutoCloseable {

    private final SecretStore delegate;
    private final ExecutorService executor;

    /**
     * Wraps a store using a dedicated pool of daemon worker threads.
     *
     * @param delegate the store to bound
     */
    public TimeoutBoundSecretStore(SecretStore delegate) {
        this(delegate, Executors.newCachedThreadPool(new FetchThreadFactory()));
    }

    /**
     * Wraps a store using the given executor. The executor is shut down by {@link #close()}.
     *
     * @param delegate the store to bound
     * @param executor executor running the fetches
     */
    public TimeoutBoundSecretStore(SecretStore delegate, ExecutorService executor) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate must not be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor must not be null");
        }
        this.delegate = delegate;
        this.executor = executor;
    }

    @Override
    public String fetch(String name, boolean decrypt, Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new SecretStoreUnavailableException(
                    "Deadline exceeded before fetching secret '%s'".formatted(name));
        }

        Future<String> future;
        try {
            future = executor.submit(task(name, decrypt, timeout));
        } catch (RejectedExecutionException e) {
            throw new SecretStoreUnavailableException(
                    "Fetch executor rejected request for secret '%s'".formatted(name), e);
        }

        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new SecretStoreUnavailableException(
                    "Timed out after %d ms fetching secret '%s'".formatted(timeout.toMillis(), name), e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new SecretStoreUnavailableException(
                    "Interrupted while fetching secret '%s'".formatted(name), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SecretStoreUnavailableException unavailable) {
                throw unavailable;
            }
            throw new SecretStoreUnavailableException(
                    "Fetching secret '%s' failed with %s".formatted(name, cause.getClass().getSimpleName()), cause);
        }
    }

    private Callable<String> task(String name, boolean decrypt, Duration timeout) {
        CorrelationContext caller = CorrelationContextHolder.get().orElse(null);
        if (caller == null) {
            return () -> delegate.fetch(name, decrypt, timeout);
        }
        return () -> CorrelationContextHolder.callWithContext(caller, () -> delegate.fetch(name, decrypt, timeout));
    }

    @Override
    public void close() {
        executor.shutdownNow();
        if (delegate instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                throw new IllegalStateException("Failed to close secret store", e);
            }
        }
    }

    private static final class FetchThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "secret-fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
