package com.substratebridge.core.ordered;

import com.substratebridge.core.broker.IProducerClient;
import com.substratebridge.core.broker.IProducerSession;
import com.substratebridge.core.broker.OutboundRecord;
import com.substratebridge.core.broker.SendResult;
import com.substratebridge.core.error.BrokerConnectivityException;
import com.substratebridge.core.error.MessagePublishException;
import com.substratebridge.core.metrics.SinkMetrics;
import com.substratebridge.core.msg.Message;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SynchronousSink;
import reactor.util.annotation.Nullable;

import java.util.function.Function;

/**
 * Forwards outbound messages to the broker and republishes broker confirmations as acknowledgments.
 * <p>
 * Every message travels as the correlation metadata of its own send, so the acknowledgment is the
 * very reference the caller handed over. Sending and draining confirmations run concurrently inside
 * the producer session, so a caller slow to consume acknowledgments cannot stall sends and vice versa.
 * </p>
 * <p>
 * <b>Cancellation:</b> the producer session is closed with a bounded drain. Sends already handed
 * over may still land, but their acknowledgments are not emitted.
 * </p>
 */
public class OrderedPublisher {
    private static final Logger log = LoggerFactory.getLogger(OrderedPublisher.class);

    private final IProducerClient client;
    private final Function<? super Message, byte[]> keyFunction;
    private final SinkMetrics metrics;

    /**
     * @param client      broker client opening one producer session per publish
     * @param keyFunction derives the partitioning key; null spreads messages round-robin
     * @param metrics     publish path counters
     */
    public OrderedPublisher(IProducerClient client,
                            @Nullable Function<? super Message, byte[]> keyFunction,
                            SinkMetrics metrics) {
        this.client = client;
        this.keyFunction = keyFunction;
        this.metrics = metrics;
    }

    /**
     * Runs one publish session.
     *
     * @param messages outbound messages
     * @return acknowledged messages, in broker confirmation order; a failure of {@code messages}
     * itself is propagated unchanged
     */
    public Flux<Message> publish(Publisher<? extends Message> messages) {
        return Flux.usingWhen(
                Mono.fromCallable(client::openProducerSession)
                    .onErrorMap(error -> BrokerConnectivityException.wrap("Cannot open producer session", error)),
                session -> runSession(session, messages),
                session -> release(session, "completed"),
                (session, error) -> release(session, "failed"),
                session -> release(session, "cancelled")
            )
            .doOnError(BrokerConnectivityException.class, error -> {
                metrics.recordFailure();
                log.error("Terminating publish session: {}", error.getMessage());
            });
    }

    private Flux<Message> runSession(IProducerSession session, Publisher<? extends Message> messages) {
        log.info("Producer session started");
        Flux<OutboundRecord<Message>> records = Flux.<Message>from(messages)
            .map(this::toRecord)
            .doOnNext(record -> metrics.recordSent())
            .onErrorMap(CallerStreamFailure::new);

        return session.send(records)
            .onErrorMap(error -> error instanceof CallerStreamFailure
                ? error.getCause()
                : BrokerConnectivityException.wrap("Broker send failed", error))
            .handle(this::forward);
    }

    private OutboundRecord<Message> toRecord(Message message) {
        byte[] key = keyFunction == null ? null : keyFunction.apply(message);
        return new OutboundRecord<>(key, message.getData(), message);
    }

    private void forward(SendResult<Message> result, SynchronousSink<Message> sink) {
        Message message = result.getCorrelationMetadata();
        if (!result.isSuccess()) {
            sink.error(new MessagePublishException(message, result.getException()));
            return;
        }
        metrics.recordAcked();
        log.debug("Broker confirmed {} at partition {} offset {}", message, result.getPartition(), result.getOffset());
        sink.next(message);
    }

    private Mono<Void> release(IProducerSession session, String reason) {
        return session.close()
            .doOnSuccess(v -> log.info("Producer session closed ({})", reason))
            .onErrorResume(error -> {
                log.warn("Failed to close producer session ({}): {}", reason, error.getMessage(), error);
                return Mono.empty();
            });
    }

    /**
     * Carries a failure of the caller's message stream through the broker session untouched.
     */
    private static final class CallerStreamFailure extends RuntimeException {
        private CallerStreamFailure(Throwable cause) {
            super(cause.getMessage(), cause, false, false);
        }
    }
}
