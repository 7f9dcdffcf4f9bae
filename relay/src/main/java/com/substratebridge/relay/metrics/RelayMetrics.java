package com.substratebridge.relay.metrics;

import com.substratebridge.core.metrics.MetricsNames;
import com.substratebridge.core.metrics.MetricsTags;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.Metrics;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Relay meters and their Prometheus rendering.
 * <p>
 * {@link #getRegistry()} is where the source and sink register their own meters; {@link #scrape()}
 * renders everything that registry holds, reactor-netty's HTTP meters included when created through
 * {@link #create(String)}.
 * </p>
 */
public class RelayMetrics {
    private static final Logger log = LoggerFactory.getLogger(RelayMetrics.class);

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;

    private final Counter restarts;
    private final Counter relayed;
    private final AtomicInteger unconfirmed = new AtomicInteger();

    /**
     * @param registry           registry the meters are registered with
     * @param prometheusRegistry registry rendered by {@link #scrape()}; must be, or be part of, {@code registry}
     */
    public RelayMetrics(MeterRegistry registry, PrometheusMeterRegistry prometheusRegistry, String relayId) {
        this.registry = registry;
        this.prometheusRegistry = prometheusRegistry;

        restarts = Counter.builder(MetricsNames.RELAY_RESTARTS_TOTAL)
            .tag(MetricsTags.RELAY_ID, relayId)
            .description("Relay session restarts after a broker failure")
            .register(registry);

        relayed = Counter.builder(MetricsNames.RELAY_RELAYED_TOTAL)
            .tag(MetricsTags.RELAY_ID, relayId)
            .description("Messages confirmed by the sink and acknowledged on the source")
            .register(registry);

        Gauge.builder(MetricsNames.RELAY_UNCONFIRMED, unconfirmed, AtomicInteger::get)
            .tag(MetricsTags.RELAY_ID, relayId)
            .description("Delivered messages awaiting sink confirmation")
            .register(registry);
    }

    /**
     * Metrics on reactor-netty's global composite registry, with a Prometheus registry attached to it.
     */
    public static RelayMetrics create(String relayId) {
        MeterRegistry global = Metrics.REGISTRY;
        PrometheusMeterRegistry prometheus = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        if (global instanceof CompositeMeterRegistry composite) {
            composite.add(prometheus);
        }
        global.config().commonTags(MetricsTags.RELAY_ID, relayId);
        log.info("Relay metrics registered on the global registry with Prometheus export");
        return new RelayMetrics(global, prometheus, relayId);
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }

    public void recordRestart() {
        restarts.increment();
    }

    public void recordTracked() {
        unconfirmed.incrementAndGet();
    }

    public void recordReleased(int count) {
        if (count > 0) {
            relayed.increment(count);
            unconfirmed.addAndGet(-count);
        }
    }

    /**
     * Session ended with {@code count} messages still unconfirmed; they will be redelivered.
     */
    public void recordAbandoned(int count) {
        unconfirmed.addAndGet(-count);
    }
}
