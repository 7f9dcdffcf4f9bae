package com.substratebridge.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counters and gauges of the consume path.
 */
public class SourceMetrics {

    private final Counter delivered;
    private final Counter committed;
    private final Counter invalidAcks;
    private final Counter brokerFailures;
    private final AtomicInteger inFlight = new AtomicInteger();

    public SourceMetrics(MeterRegistry registry, String topic, String group) {
        delivered = Counter.builder(MetricsNames.SOURCE_DELIVERED_TOTAL)
            .tag(MetricsTags.TOPIC, topic)
            .tag(MetricsTags.GROUP, group)
            .description("Messages delivered to the caller")
            .register(registry);

        committed = Counter.builder(MetricsNames.SOURCE_COMMITTED_TOTAL)
            .tag(MetricsTags.TOPIC, topic)
            .tag(MetricsTags.GROUP, group)
            .description("Offsets committed after a valid acknowledgment")
            .register(registry);

        invalidAcks = Counter.builder(MetricsNames.SOURCE_FAILURES_TOTAL)
            .tag(MetricsTags.TOPIC, topic)
            .tag(MetricsTags.GROUP, group)
            .tag(MetricsTags.REASON, "invalid_ack")
            .register(registry);

        brokerFailures = Counter.builder(MetricsNames.SOURCE_FAILURES_TOTAL)
            .tag(MetricsTags.TOPIC, topic)
            .tag(MetricsTags.GROUP, group)
            .tag(MetricsTags.REASON, "broker")
            .register(registry);

        Gauge.builder(MetricsNames.SOURCE_IN_FLIGHT, inFlight, AtomicInteger::get)
            .tag(MetricsTags.TOPIC, topic)
            .tag(MetricsTags.GROUP, group)
            .description("Delivered but not yet acknowledged messages")
            .register(registry);
    }

    public void recordDelivered() {
        delivered.increment();
        inFlight.incrementAndGet();
    }

    public void recordCommitted() {
        committed.increment();
        inFlight.decrementAndGet();
    }

    /**
     * Forgets the outstanding deliveries of a finished session.
     *
     * @param discarded number of unacknowledged deliveries
     */
    public void recordDiscarded(int discarded) {
        inFlight.addAndGet(-discarded);
    }

    public void recordInvalidAck() {
        invalidAcks.increment();
    }

    public void recordBrokerFailure() {
        brokerFailures.increment();
    }
}
