package com.tollgate.security;

import com.tollgate.observability.CorrelationContext;
import com.tollgate.observability.CorrelationContextHolder;
import com.tollgate.security.testing.InMemorySecretStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TimeoutBoundSecretStore")
class TimeoutBoundSecretStoreTest {

    private TimeoutBoundSecretStore bounded;

    @AfterEach
    void tearDown() {
        CorrelationContextHolder.clear();
        if (bounded != null) {
            bounded.close();
        }
    }

    @Test
    @DisplayName("returns the delegate's value within the timeout")
    void returnsValue() {
        bounded = new TimeoutBoundSecretStore(new InMemorySecretStore("secret123"));
        assertThat(bounded.fetch("name", true, Duration.ofSeconds(1))).isEqualTo("secret123");
    }

    @Test
    @DisplayName("gives up and interrupts a hung delegate")
    void timesOut() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        SecretStore hung = (name, decrypt, timeout) -> {
            try {
                Thread.sleep(60_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return "too-late";
        };
        bounded = new TimeoutBoundSecretStore(hung);

        long start = System.nanoTime();
        assertThatThrownBy(() -> bounded.fetch("name", true, Duration.ofMillis(100)))
                .isInstanceOf(SecretStoreUnavailableException.class)
                .hasMessageContaining("Timed out");
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("rejects a non-positive timeout without calling the delegate")
    void rejectsExpiredDeadline() {
        var store = new InMemorySecretStore("secret123");
        bounded = new TimeoutBoundSecretStore(store);

        assertThatThrownBy(() -> bounded.fetch("name", true, Duration.ZERO))
                .isInstanceOf(SecretStoreUnavailableException.class);
        assertThatThrownBy(() -> bounded.fetch("name", true, Duration.ofMillis(-5)))
                .isInstanceOf(SecretStoreUnavailableException.class);
        assertThat(store.fetchCount()).isZero();
    }

    @Test
    @DisplayName("rethrows store-unavailable failures unchanged")
    void passesThroughUnavailable() {
        bounded = new TimeoutBoundSecretStore(new InMemorySecretStore("x").setFailing());

        assertThatThrownBy(() -> bounded.fetch("name", true, Duration.ofSeconds(1)))
                .isInstanceOf(SecretStoreUnavailableException.class)
                .hasMessageContaining("Simulated store failure");
    }

    @Test
    @DisplayName("wraps other delegate failures")
    void wrapsOtherFailures() {
        bounded = new TimeoutBoundSecretStore((name, decrypt, timeout) -> {
            throw new IllegalStateException("boom");
        });

        assertThatThrownBy(() -> bounded.fetch("name", true, Duration.ofSeconds(1)))
                .isInstanceOf(SecretStoreUnavailableException.class)
                .hasMessageContaining("IllegalStateException")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("fails after close instead of hanging")
    void failsAfterClose() {
        bounded = new TimeoutBoundSecretStore(new InMemorySecretStore("x"));
        bounded.close();

        assertThatThrownBy(() -> bounded.fetch("name", true, Duration.ofSeconds(1)))
                .isInstanceOf(SecretStoreUnavailableException.class);
    }

    @Test
    @DisplayName("closes a closeable delegate")
    void closesDelegate() {
        AtomicBoolean closed = new AtomicBoolean();
        class CloseableStore implements SecretStore, AutoCloseable {
            @Override
            public String fetch(String name, boolean decrypt, Duration timeout) {
                return "x";
            }

            @Override
            public void close() {
                closed.set(true);
            }
        }
        bounded = new TimeoutBoundSecretStore(new CloseableStore());
        bounded.close();

        assertThat(closed).isTrue();
    }

    @Test
    @DisplayName("carries the caller's correlation id onto the worker and clears it afterwards")
    void propagatesCorrelationContext() {
        SecretStore mdcEcho = (name, decrypt, timeout) -> String.valueOf(MDC.get(CorrelationContext.MDC_CORRELATION_ID));
        bounded = new TimeoutBoundSecretStore(mdcEcho, Executors.newSingleThreadExecutor());

        CorrelationContextHolder.set(CorrelationContext.of("corr-42", "req-1"));
        assertThat(bounded.fetch("name", true, Duration.ofSeconds(1))).isEqualTo("corr-42");

        CorrelationContextHolder.clear();
        assertThat(bounded.fetch("name", true, Duration.ofSeconds(1))).isEqualTo("null");
    }
}
