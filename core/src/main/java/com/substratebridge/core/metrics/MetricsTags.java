package com.substratebridge.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for broker topic.
     */
    public static final String TOPIC = "topic";

    /**
     * Tag key for consumer group.
     */
    public static final String GROUP = "group";

    /**
     * Tag key for failure reason.
     */
    public static final String REASON = "reason";

    /**
     * Tag key for relay instance identifier.
     */
    public static final String RELAY_ID = "relay_id";
}
