package com.substratebridge.core.metrics;

/**
 * Micrometer metric names used across the system.
 * <p>
 * <b>Naming convention:</b> {@code substrate.<role>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Messages handed to the broker.
     * <p>
     * Tags: topic
     * </p>
     */
    public static final String SINK_SENT_TOTAL = "substrate.sink.sent.total";

    /**
     * Counter: Messages confirmed by the broker and acknowledged to the caller.
     * <p>
     * Tags: topic
     * </p>
     */
    public static final String SINK_ACKED_TOTAL = "substrate.sink.acked.total";

    /**
     * Counter: Publish invocations terminated by a broker error.
     * <p>
     * Tags: topic
     * </p>
     */
    public static final String SINK_FAILURES_TOTAL = "substrate.sink.failures.total";

    /**
     * Counter: Messages delivered to the caller.
     * <p>
     * Tags: topic, group
     * </p>
     */
    public static final String SOURCE_DELIVERED_TOTAL = "substrate.source.delivered.total";

    /**
     * Counter: Offsets committed after a valid acknowledgment.
     * <p>
     * Tags: topic, group
     * </p>
     */
    public static final String SOURCE_COMMITTED_TOTAL = "substrate.source.committed.total";

    /**
     * Counter: Consume invocations terminated, by reason.
     * <p>
     * Tags: topic, group, reason (invalid_ack/broker)
     * </p>
     */
    public static final String SOURCE_FAILURES_TOTAL = "substrate.source.failures.total";

    /**
     * Gauge: Messages delivered but not yet acknowledged, summed over live sessions.
     * <p>
     * Tags: topic, group
     * </p>
     */
    public static final String SOURCE_IN_FLIGHT = "substrate.source.in.flight";

    /**
     * Counter: Relay session restarts after a failure.
     * <p>
     * Tags: relay_id
     * </p>
     */
    public static final String RELAY_RESTARTS_TOTAL = "substrate.relay.restarts.total";

    /**
     * Counter: Messages confirmed by the sink and acknowledged on the source.
     * <p>
     * Tags: relay_id
     * </p>
     */
    public static final String RELAY_RELAYED_TOTAL = "substrate.relay.relayed.total";

    /**
     * Gauge: Messages delivered by the source whose sink confirmation is still outstanding.
     * <p>
     * Tags: relay_id
     * </p>
     */
    public static final String RELAY_UNCONFIRMED = "substrate.relay.unconfirmed";
}
