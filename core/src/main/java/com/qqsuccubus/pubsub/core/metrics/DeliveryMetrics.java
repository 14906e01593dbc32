package com.qqsuccubus.pubsub.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;

/**
 * Centralized metrics for publishing and subscribing.
 * <p>
 * Counters are tagged per channel and looked up on demand; the registry returns the
 * already registered meter for a known name and tag set.
 * </p>
 */
public class DeliveryMetrics {

    private final MeterRegistry registry;
    private final Timer publishLatency;

    public DeliveryMetrics(MeterRegistry registry) {
        this.registry = registry;

        publishLatency = Timer.builder(MetricsNames.PUBLISH_LATENCY)
            .description("Publish script round trip latency")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(1),
                Duration.ofMillis(5),
                Duration.ofMillis(10),
                Duration.ofMillis(50),
                Duration.ofMillis(100)
            )
            .register(registry);
    }

    /**
     * Metrics kept in a private in-memory registry, for callers that do not export any.
     */
    public static DeliveryMetrics inMemory() {
        return new DeliveryMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    public void recordExpected(String channel) {
        counter(MetricsNames.EXPECTED_TOTAL, channel, "Messages delivered in order").increment();
    }

    public void recordRecovered(String channel) {
        counter(MetricsNames.RECOVERED_TOTAL, channel, "Messages recovered from the store").increment();
    }

    public void recordDuplicated(String channel) {
        counter(MetricsNames.DUPLICATED_TOTAL, channel, "Messages received more than once").increment();
    }

    public void recordUnrecoverable(String channel, long count) {
        counter(MetricsNames.UNRECOVERABLE_TOTAL, channel, "Gap messages that could not be recovered")
            .increment(count);
    }

    public void recordInvalidFormat(String channel) {
        counter(MetricsNames.INVALID_TOTAL, channel, "Payloads dropped due to invalid format").increment();
    }

    public void recordCheck(String channel, boolean succeeded) {
        Counter.builder(MetricsNames.MONITOR_CHECKS_TOTAL)
            .tag(MetricsTags.CHANNEL, channel)
            .tag(MetricsTags.RESULT, succeeded ? "ok" : "failed")
            .description("Missed-message checks run by the delivery monitor")
            .register(registry)
            .increment();
    }

    public void recordPublishLatency(Duration duration) {
        publishLatency.record(duration);
    }

    private Counter counter(String name, String channel, String description) {
        return Counter.builder(name)
            .tag(MetricsTags.CHANNEL, channel)
            .description(description)
            .register(registry);
    }
}
