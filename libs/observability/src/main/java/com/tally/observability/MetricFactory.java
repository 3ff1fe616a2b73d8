package com.tally.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Factory for Micrometer meters carrying a {@code service} tag.
 *
 * <p>Tenant ids are deliberately not used as tags: tenant counts are unbounded and would explode
 * metric cardinality. Per-tenant numbers live in the quota counters instead.
 *
 * <p>Micrometer returns the already-registered meter for a repeated name and tag set, so callers
 * may look meters up on every use.
 */
public final class MetricFactory {

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * Creates a MetricFactory bound to the given registry and service name.
     *
     * @param registry the Micrometer meter registry (e.g., PrometheusMeterRegistry)
     * @param serviceName logical service name included as a default tag
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
     * Creates (or looks up) a counter.
     *
     * @param name metric name (e.g., "tally.usage.reports")
     * @param description human-readable description
     * @param tags additional tags (key-value pairs)
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name).description(description).tags(baseTags(tags)).register(registry);
    }

    /** Creates (or looks up) a timer. */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name).description(description).tags(baseTags(tags)).register(registry);
    }

    /** Creates (or looks up) a distribution summary. */
    public DistributionSummary distributionSummary(
            String name, String description, String... tags) {
        return DistributionSummary.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /** Returns the underlying meter registry. */
    public MeterRegistry registry() {
        return registry;
    }

    /** Returns the service name used as a default tag. */
    public String serviceName() {
        return serviceName;
    }

    private Tags baseTags(String... extraTags) {
        if (extraTags.length % 2 != 0) {
            throw new IllegalArgumentException("tags must be key-value pairs");
        }
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
