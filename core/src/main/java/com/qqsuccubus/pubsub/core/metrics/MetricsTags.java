package com.qqsuccubus.pubsub.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for channel name.
     */
    public static final String CHANNEL = "channel";

    /**
     * Tag key for an operation result (ok/failed).
     */
    public static final String RESULT = "result";
}
