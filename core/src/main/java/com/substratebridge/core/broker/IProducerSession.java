package com.substratebridge.core.broker;

import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Broker producer exclusively owned by one publish invocation.
 */
public interface IProducerSession {

    /**
     * Sends records asynchronously.
     * <p>
     * Emits exactly one {@link SendResult} per record, carrying the record's correlation metadata,
     * in the order the broker answers. A per-record failure is reported as a failed result;
     * a failure of the session itself terminates the flux with an error.
     * </p>
     *
     * @param records records to send
     * @param <T>     correlation metadata type
     * @return send outcomes
     */
    <T> Flux<SendResult<T>> send(Publisher<OutboundRecord<T>> records);

    /**
     * Closes the session. Records already handed over get a bounded time to land.
     *
     * @return Mono completing when the session is closed
     */
    Mono<Void> close();
}
