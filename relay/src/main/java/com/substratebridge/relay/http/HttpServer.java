package com.substratebridge.relay.http;

import com.substratebridge.core.util.JsonUtils;
import com.substratebridge.relay.config.RelayConfig;
import com.substratebridge.relay.health.HealthService;
import com.substratebridge.relay.metrics.RelayMetrics;
import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;

import java.time.Duration;
import java.util.function.Function;

/**
 * HTTP server for health checks, the status report and metrics.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final RelayConfig config;
    private final HealthService healthService;
    private final RelayMetrics metrics;
    private DisposableServer server;

    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(routes -> routes
                // 503 when either topic is degraded or unreachable
                .get("/healthz", (req, res) -> healthService.check()
                    .flatMap(report -> report.isHealthy()
                        ? res.status(200).sendString(Mono.just("OK")).then()
                        : res.status(503).sendString(Mono.just("Unhealthy")).then()))
                .get("/status", (req, res) -> healthService.check()
                    .map(JsonUtils::writeValueAsString)
                    .flatMap(json -> res.status(200)
                        .header("Content-Type", "application/json")
                        .sendString(Mono.just(json))
                        .then()))
                .get("/metrics", (req, res) ->
                    res.header("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                        .sendString(Mono.just(metrics.scrape()))
                )
            )
            .bind()
            .doOnNext(bound -> log.info("HTTP server started on port {}", bound.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(30));
        }
    }
}
