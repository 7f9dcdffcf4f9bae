package com.substratebridge.core.broker;

import lombok.ToString;
import lombok.Value;

/**
 * A record handed to the broker for sending.
 *
 * @param <T> type of the correlation metadata echoed back in the {@link SendResult}
 */
@Value
public class OutboundRecord<T> {

    /**
     * Partitioning key. Null spreads records round-robin across partitions.
     */
    @ToString.Exclude
    byte[] key;

    @ToString.Exclude
    byte[] value;

    /**
     * Opaque token returned unchanged with the send outcome.
     */
    T correlationMetadata;
}
