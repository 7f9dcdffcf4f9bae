package com.substratebridge.relay.relay;

import com.substratebridge.core.api.IAsyncMessageSink;
import com.substratebridge.core.api.IAsyncMessageSource;
import com.substratebridge.core.error.BrokerConnectivityException;
import com.substratebridge.core.msg.Message;
import com.substratebridge.core.util.JitterBackoff;
import com.substratebridge.relay.metrics.RelayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;

/**
 * Copies every message of a source to a sink with at-least-once delivery.
 * <p>
 * <b>Flow:</b>
 * <pre>
 * 1. Source deliveries are tracked in delivery order and published to the sink
 * 2. Sink acknowledgments arrive in broker confirmation order
 * 3. {@link OrderedAckBuffer} releases the in-order prefix, which is acknowledged on the source
 * </pre>
 * </p>
 * <p>
 * Source offsets therefore only advance over messages the sink has durably accepted. A broker
 * failure on either side restarts both sessions after a jittered backoff; unacknowledged messages
 * are redelivered. Acknowledgment protocol violations are not retried.
 * </p>
 */
public class MessageRelay {
    private static final Logger log = LoggerFactory.getLogger(MessageRelay.class);

    private final IAsyncMessageSource source;
    private final IAsyncMessageSink sink;
    private final JitterBackoff backoff;
    private final RelayMetrics metrics;

    public MessageRelay(IAsyncMessageSource source, IAsyncMessageSink sink, JitterBackoff backoff,
                        RelayMetrics metrics) {
        this.source = source;
        this.sink = sink;
        this.backoff = backoff;
        this.metrics = metrics;
    }

    /**
     * Runs the relay until cancelled.
     *
     * @return messages acknowledged on the source, in delivery order
     */
    public Flux<Message> run() {
        return Flux.defer(this::relaySession)
            .retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
                Throwable failure = signal.failure();
                if (!(failure instanceof BrokerConnectivityException)) {
                    log.error("Relay stopped: {}", failure.getMessage(), failure);
                    return Mono.<Long>error(failure);
                }
                Duration delay = backoff.next(signal.totalRetriesInARow());
                metrics.recordRestart();
                log.warn("Relay session failed ({}), restarting in {} ms", failure.getMessage(), delay.toMillis());
                return Mono.delay(delay);
            })));
    }

    private Flux<Message> relaySession() {
        OrderedAckBuffer buffer = new OrderedAckBuffer();
        Sinks.Many<Message> sourceAcks = Sinks.many().unicast().onBackpressureBuffer();
        log.info("Relay session started");

        Flux<Message> deliveries = source.consumeMessages(sourceAcks.asFlux())
            .doOnNext(message -> {
                buffer.track(message);
                metrics.recordTracked();
            });

        return sink.publishMessages(deliveries)
            .concatMapIterable(confirmed -> {
                List<Message> released = buffer.complete(confirmed);
                metrics.recordReleased(released.size());
                return released;
            })
            .doOnNext(released -> {
                Sinks.EmitResult result = sourceAcks.tryEmitNext(released);
                if (result.isFailure()) {
                    log.debug("Source session already ended, dropping acknowledgment of {} ({})", released, result);
                }
            })
            .doFinally(signal -> {
                int pending = buffer.pending();
                metrics.recordAbandoned(pending);
                log.info("Relay session ended ({}) with {} unconfirmed messages", signal, pending);
            });
    }
}
