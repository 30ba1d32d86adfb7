package com.tollgate.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.function.Supplier;

/**
 * Creates Micrometer meters that all carry a {@code service} tag.
 * <p>
 * Meters are registered on first use and looked up afterwards, so asking for the same
 * name and tags on every request returns the same meter.
 */
public final class MetricFactory {

    /** Tag key for the emitting service. */
    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * @param registry    meter registry (Prometheus in the service, simple in tests)
     * @param serviceName value of the {@value #TAG_SERVICE} tag
     */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Returns a counter.
     *
     * @param name        meter name, e.g. {@code tollgate.authorizer.decisions}
     * @param description human-readable description
     * @param tags        extra tags as key/value pairs
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(tags(tags))
                .register(registry);
    }

    /**
     * Returns a timer.
     *
     * @param name        meter name
     * @param description human-readable description
     * @param tags        extra tags as key/value pairs
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(tags(tags))
                .register(registry);
    }

    /**
     * Registers a gauge that samples the supplier on every scrape.
     *
     * @param name        meter name
     * @param description human-readable description
     * @param supplier    current value
     * @param tags        extra tags as key/value pairs
     */
    public Gauge gauge(String name, String description, Supplier<Number> supplier, String... tags) {
        if (supplier == null) {
            throw new IllegalArgumentException("supplier must not be null");
        }
        return Gauge.builder(name, supplier)
                .description(description)
                .tags(tags(tags))
                .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags tags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        return extraTags.length > 0 ? tags.and(extraTags) : tags;
    }
}
