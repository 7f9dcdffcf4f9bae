package com.substratebridge.core.ordered;

import com.substratebridge.core.broker.BrokerOffset;
import com.substratebridge.core.broker.IConsumerClient;
import com.substratebridge.core.broker.IConsumerSession;
import com.substratebridge.core.error.BrokerConnectivityException;
import com.substratebridge.core.error.InvalidAcknowledgmentException;
import com.substratebridge.core.metrics.SourceMetrics;
import com.substratebridge.core.msg.Message;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Streams broker records to the caller and commits offsets strictly in acknowledgment order.
 * <p>
 * <b>Session lifecycle:</b>
 * <pre>
 * 1. Subscription opens a dedicated consumer session
 * 2. Each record is wrapped in a fresh {@link DeliveredMessage}, appended to the ledger and delivered
 * 3. Each acknowledgment must be the ledger head; its offset is committed, then the head is popped
 * 4. Cancellation, ack completion, broker error or invalid ack ends the session and closes it
 * </pre>
 * </p>
 * <p>
 * Append and hand-over are one synchronous step, so a record that is never handed to the caller
 * (no demand, cancelled first) never enters the ledger. Unacknowledged entries are dropped when the
 * session ends; the next session resumes from the last committed offset and redelivers them.
 * </p>
 * <p>
 * Acknowledgments are consumed eagerly, independent of delivery demand.
 * </p>
 */
public class OrderedConsumer {
    private static final Logger log = LoggerFactory.getLogger(OrderedConsumer.class);

    private final IConsumerClient client;
    private final SourceMetrics metrics;

    public OrderedConsumer(IConsumerClient client, SourceMetrics metrics) {
        this.client = client;
        this.metrics = metrics;
    }

    /**
     * Runs one consumption session.
     *
     * @param acks acknowledgments, in delivery order
     * @return delivered messages; a failure of {@code acks} itself is propagated unchanged
     */
    public Flux<Message> consume(Publisher<? extends Message> acks) {
        return Flux.usingWhen(
                Mono.fromCallable(client::openConsumerSession)
                    .onErrorMap(error -> BrokerConnectivityException.wrap("Cannot open consumer session", error)),
                session -> runSession(session, acks),
                session -> release(session, "acks completed"),
                (session, error) -> release(session, "failed"),
                session -> release(session, "cancelled")
            );
    }

    private Flux<Message> runSession(IConsumerSession session, Publisher<? extends Message> acks) {
        AckLedger<DeliveredMessage> ledger = new AckLedger<>();
        log.info("Consumer session started");

        Mono<Void> acknowledgements = Flux.<Message>from(acks)
            .doOnNext(ack -> acknowledge(ledger, ack))
            .doOnError(InvalidAcknowledgmentException.class, error -> {
                metrics.recordInvalidAck();
                log.error("Terminating consumer session: {}", error.getMessage());
            })
            .then();

        return session.receive()
            .onErrorMap(error -> BrokerConnectivityException.wrap("Broker consumption failed", error))
            .doOnError(BrokerConnectivityException.class, error -> {
                metrics.recordBrokerFailure();
                log.error("Terminating consumer session: {}", error.getMessage());
            })
            .map(DeliveredMessage::new)
            .takeUntilOther(acknowledgements)
            .doOnNext(delivered -> {
                ledger.append(delivered);
                metrics.recordDelivered();
                log.debug("Delivered {}", delivered);
            })
            .doFinally(signal -> {
                int discarded = ledger.clear();
                metrics.recordDiscarded(discarded);
                if (discarded > 0) {
                    log.info("Consumer session ended ({}) with {} unacknowledged messages, they will be redelivered",
                        signal, discarded);
                }
            })
            .cast(Message.class);
    }

    private void acknowledge(AckLedger<DeliveredMessage> ledger, Message ack) {
        DeliveredMessage acked = ledger.acknowledge(ack, head -> head.offset().commit());
        metrics.recordCommitted();
        if (log.isDebugEnabled()) {
            BrokerOffset offset = acked.offset();
            log.debug("Committed partition {} offset {}", offset.partition(), offset.offset());
        }
    }

    private Mono<Void> release(IConsumerSession session, String reason) {
        return session.close()
            .doOnSuccess(v -> log.info("Consumer session released ({})", reason))
            .onErrorResume(error -> {
                // Acknowledged offsets were handed to the broker client when acknowledged.
                log.warn("Failed to close consumer session ({}): {}", reason, error.getMessage(), error);
                return Mono.empty();
            });
    }
}
