package com.qqsuccubus.pubsub.core.metrics;

/**
 * Micrometer metric names used across the system.
 * <p>
 * <b>Naming convention:</b> {@code pubsub.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Messages delivered in order through the expected-message callback.
     * <p>
     * Tags: channel
     * </p>
     */
    public static final String EXPECTED_TOTAL = "pubsub.subscriber.expected.total";

    /**
     * Counter: Messages recovered from the store and handed to the missed-message callback.
     * <p>
     * Tags: channel
     * </p>
     */
    public static final String RECOVERED_TOTAL = "pubsub.subscriber.recovered.total";

    /**
     * Counter: Messages received again after their id was already processed.
     * <p>
     * Tags: channel
     * </p>
     */
    public static final String DUPLICATED_TOTAL = "pubsub.subscriber.duplicated.total";

    /**
     * Counter: Messages of a gap that could not be recovered (expired or never stored).
     * <p>
     * Tags: channel
     * </p>
     */
    public static final String UNRECOVERABLE_TOTAL = "pubsub.subscriber.unrecoverable.total";

    /**
     * Counter: Raw payloads dropped because they are not in wire format.
     * <p>
     * Tags: channel
     * </p>
     */
    public static final String INVALID_TOTAL = "pubsub.subscriber.invalid.total";

    /**
     * Counter: Missed-message checks run by the delivery monitor.
     * <p>
     * Tags: channel, result (ok/failed)
     * </p>
     */
    public static final String MONITOR_CHECKS_TOTAL = "pubsub.monitor.checks.total";

    /**
     * Timer: Latency of the publish script round trip.
     * <p>
     * Tags: (none)
     * </p>
     */
    public static final String PUBLISH_LATENCY = "pubsub.publisher.latency";
}
