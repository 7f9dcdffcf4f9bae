package com.substratebridge.core.broker;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Shared connection to the broker, used for metadata queries.
 */
public interface IBrokerClient extends AutoCloseable {

    /**
     * Describes the partitions of a topic.
     * <p>
     * An unknown topic yields an empty list. A broker that cannot be reached yields an error.
     * </p>
     *
     * @param topic topic name
     * @return per-partition health
     */
    Mono<List<PartitionHealth>> describePartitions(String topic);

    @Override
    void close();
}
