package com.warden.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates Micrometer meters that all carry the {@code service} tag.
 *
 * <p>Meter names used by the authorization core are collected in {@link Names} so dashboards and
 * code agree on them.
 */
public final class MetricFactory {

    public static final String TAG_SERVICE = "service";

    /** Meter names emitted by the authorization core. */
    public static final class Names {
        public static final String SCOPE_UPDATES = "warden.scope.updates";
        public static final String SESSIONS_INVALIDATED = "warden.sessions.invalidated";
        public static final String CONSISTENCY_CHECKS = "warden.consistency.checks";
        public static final String POLICY_DECISIONS = "warden.policy.decisions";
        public static final String POLICY_LATENCY = "warden.policy.latency";
        public static final String NOTIFICATIONS_DELIVERED = "warden.notifications.delivered";
        public static final String NOTIFICATION_CONNECTIONS = "warden.notifications.connections";

        private Names() {}
    }

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * @param registry the meter registry (Prometheus in the service, simple registry in tests)
     * @param serviceName logical service name added as the {@code service} tag
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
     * Returns (registering on first use) a counter.
     *
     * @param tags additional key-value pairs, e.g. {@code "outcome", "changed"}
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /** Increments a counter by one; shorthand for hot paths. */
    public void increment(String name, String description, String... tags) {
        counter(name, description, tags).increment();
    }

    /** Returns (registering on first use) a timer. */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Registers a gauge backed by an {@link AtomicLong} the caller updates.
     */
    public AtomicLong gauge(String name, String description, String... tags) {
        AtomicLong value = new AtomicLong(0);
        Gauge.builder(name, value, AtomicLong::doubleValue)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
        return value;
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
