package com.substratebridge.core.api;

import com.substratebridge.core.msg.Message;
import com.substratebridge.core.msg.Status;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Producer role of the messaging abstraction.
 * <p>
 * Callers hand over messages and receive acknowledgments; partitions, offsets and broker
 * sessions stay hidden behind this interface.
 * </p>
 */
public interface IAsyncMessageSink extends AutoCloseable {

    /**
     * Publishes every message of {@code messages} to the broker.
     * <p>
     * Each subscription owns its own broker producer session for its lifetime.
     * </p>
     * <ul>
     *   <li>Emits the very same message reference once the broker confirmed it, in broker
     *       confirmation order (not necessarily send order across partitions).</li>
     *   <li>Fails with a {@link com.substratebridge.core.error.BrokerConnectivityException} on the first
     *       broker error; nothing is emitted afterwards.</li>
     *   <li>Cancelling the subscription stops publishing without an error.</li>
     *   <li>Completes once {@code messages} completed and every handed-over message was answered.</li>
     * </ul>
     *
     * @param messages outbound messages
     * @return acknowledged messages
     */
    Flux<Message> publishMessages(Publisher<? extends Message> messages);

    /**
     * Queries the broker for the health of the sink's topic.
     *
     * @return health verdict, or an error when the broker cannot be reached at all
     */
    Mono<Status> status();

    /**
     * Releases the broker client shared by all publish sessions.
     */
    @Override
    void close();
}
