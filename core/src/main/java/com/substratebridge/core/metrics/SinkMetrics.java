package com.substratebridge.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Counters of the publish path.
 */
public class SinkMetrics {

    private final Counter sent;
    private final Counter acked;
    private final Counter failures;

    public SinkMetrics(MeterRegistry registry, String topic) {
        sent = Counter.builder(MetricsNames.SINK_SENT_TOTAL)
            .tag(MetricsTags.TOPIC, topic)
            .description("Messages handed to the broker")
            .register(registry);

        acked = Counter.builder(MetricsNames.SINK_ACKED_TOTAL)
            .tag(MetricsTags.TOPIC, topic)
            .description("Messages confirmed by the broker")
            .register(registry);

        failures = Counter.builder(MetricsNames.SINK_FAILURES_TOTAL)
            .tag(MetricsTags.TOPIC, topic)
            .description("Publish invocations terminated by a broker error")
            .register(registry);
    }

    public void recordSent() {
        sent.increment();
    }

    public void recordAcked() {
        acked.increment();
    }

    public void recordFailure() {
        failures.increment();
    }
}
