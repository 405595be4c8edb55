package com.bastion.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

/**
 * Builds Micrometer counters stamped with a {@code service} tag.
 * <p>
 * Micrometer returns the already registered meter for a known name and tag set, so
 * listeners can ask for their counter on every event instead of caching one per tag
 * combination. Tag values must come from closed sets (event types, failure codes), never
 * from subjects or tokens.
 */
public final class MetricFactory {

    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final Tags serviceTags;

    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceTags = Tags.of(TAG_SERVICE, serviceName);
    }

    /**
     * @param name        metric name, dot separated (e.g. {@code bastion.auth.events})
     * @param description shown by registries that support it
     * @param tags        key-value pairs, so an even number of strings
     * @throws IllegalArgumentException on an odd number of tag strings
     */
    public Counter counter(String name, String description, String... tags) {
        if (tags.length % 2 != 0) {
            throw new IllegalArgumentException("tags must be key-value pairs, got " + tags.length + " strings");
        }
        return Counter.builder(name)
                .description(description)
                .tags(serviceTags.and(tags))
                .register(registry);
    }
}
