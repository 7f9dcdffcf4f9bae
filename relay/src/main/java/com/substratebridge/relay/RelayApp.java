package com.substratebridge.relay;

import com.substratebridge.core.util.JitterBackoff;
import com.substratebridge.kafka.KafkaMessageSink;
import com.substratebridge.kafka.KafkaMessageSource;
import com.substratebridge.relay.config.RelayConfig;
import com.substratebridge.relay.health.HealthService;
import com.substratebridge.relay.http.HttpServer;
import com.substratebridge.relay.metrics.RelayMetrics;
import com.substratebridge.relay.relay.MessageRelay;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.Disposable;

import java.time.Clock;
import java.time.Duration;

/**
 * Main entry point for the relay service.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Copy every message of the source topic to the sink topic, at least once</li>
 *   <li>Advance source offsets only over messages the sink topic accepted</li>
 *   <li>Restart both sessions with jittered backoff on broker failures</li>
 *   <li>Expose /healthz, /status and /metrics endpoints</li>
 * </ul>
 * </p>
 */
public class RelayApp {
    private static final Logger log = LoggerFactory.getLogger(RelayApp.class);

    public static void main(String[] args) {
        RelayConfig config = RelayConfig.fromEnv();
        MDC.put("relayId", config.getRelayId());

        log.info("Starting relay: {}", config.getRelayId());
        log.info("  Kafka: {}", config.getBrokers());
        log.info("  {} ({}) -> {}", config.getSourceTopic(), config.getSourceGroup(), config.getSinkTopic());

        RelayMetrics metrics = RelayMetrics.create(config.getRelayId());
        KafkaMessageSource source = KafkaMessageSource.create(config.toSourceConfig(), metrics.getRegistry());
        KafkaMessageSink sink = KafkaMessageSink.create(config.toSinkConfig(), metrics.getRegistry());

        JitterBackoff backoff = new JitterBackoff(config.getRestartBase(), config.getRestartMax(), Duration.ofSeconds(1));
        MessageRelay relay = new MessageRelay(source, sink, backoff, metrics);
        Disposable running = relay.run().subscribe(
            acked -> { },
            err -> log.error("Relay terminated", err)
        );

        HttpServer httpServer = new HttpServer(
            config,
            new HealthService(config.getRelayId(), source, sink, Clock.systemUTC()),
            metrics
        );
        httpServer.start();

        log.info("Relay {} is ready", config.getRelayId());

        handleShutdown(config, running, httpServer, source, sink);

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static void handleShutdown(RelayConfig config,
                                       Disposable running,
                                       HttpServer httpServer,
                                       KafkaMessageSource source,
                                       KafkaMessageSink sink) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received, initiating graceful shutdown...");
            MDC.put("relayId", config.getRelayId());

            // Cancelling closes both broker sessions; unacknowledged messages are redelivered later
            running.dispose();

            httpServer.stop();

            sink.close();
            source.close();

            log.info("Shutdown complete");
        }));
    }
}
