package com.substratebridge.core.api;

import com.substratebridge.core.msg.Message;
import com.substratebridge.core.msg.Status;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Consumer role of the messaging abstraction.
 */
public interface IAsyncMessageSource extends AutoCloseable {

    /**
     * Streams messages from the broker and consumes the caller's acknowledgments.
     * <p>
     * <b>Ordering contract:</b> acknowledgments must name the delivered messages in exactly the
     * order they were delivered. Broker progress is committed only for acknowledged messages, so
     * anything delivered but not acknowledged is redelivered by the next subscription.
     * </p>
     * <ul>
     *   <li>An acknowledgment out of order, or with nothing outstanding, fails the flux with
     *       {@link com.substratebridge.core.error.InvalidAcknowledgmentException}.</li>
     *   <li>A broker failure fails the flux with
     *       {@link com.substratebridge.core.error.BrokerConnectivityException}.</li>
     *   <li>Cancelling the subscription, or completing {@code acks}, ends the session without an error.</li>
     * </ul>
     *
     * @param acks acknowledgments of previously delivered messages
     * @return delivered messages
     */
    Flux<Message> consumeMessages(Publisher<? extends Message> acks);

    /**
     * Queries the broker for the health of the source's topic.
     *
     * @return health verdict, or an error when the broker cannot be reached at all
     */
    Mono<Status> status();

    /**
     * Releases the broker client shared by all consume sessions.
     */
    @Override
    void close();
}
