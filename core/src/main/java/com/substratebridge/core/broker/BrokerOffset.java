package com.substratebridge.core.broker;

/**
 * Position of a received record within its partition.
 * <p>
 * Committing marks every record of the partition up to and including this offset as processed.
 * </p>
 */
public interface BrokerOffset {

    int partition();

    long offset();

    /**
     * Commits this position for the consumer group. May complete asynchronously.
     */
    void commit();
}
