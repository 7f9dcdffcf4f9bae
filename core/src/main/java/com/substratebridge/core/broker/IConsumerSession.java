package com.substratebridge.core.broker;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Consumer group membership exclusively owned by one consume invocation.
 */
public interface IConsumerSession {

    /**
     * Records assigned to this member, in partition order. Broker failures terminate the flux with an error.
     * May be subscribed at most once.
     *
     * @return received records
     */
    Flux<BrokerRecord> receive();

    /**
     * Releases what the session still holds once {@link #receive()} has terminated or been cancelled.
     * <p>
     * Terminating {@link #receive()} is what makes the member leave the group. Implementations backed
     * by an asynchronous client may finish leaving, and flushing offsets committed so far, after this
     * Mono completes.
     * </p>
     *
     * @return Mono completing when the session's own resources are released
     */
    Mono<Void> close();
}
