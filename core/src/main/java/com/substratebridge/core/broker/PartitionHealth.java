package com.substratebridge.core.broker;

import lombok.Builder;
import lombok.Value;

/**
 * Reachability of a single topic partition, as reported by the broker.
 */
@Value
@Builder(toBuilder = true)
public class PartitionHealth {

    int partition;

    /**
     * Broker id of the current leader, -1 when the partition has no leader.
     */
    int leaderId;

    int replicas;

    int inSyncReplicas;

    public boolean isReachable() {
        return leaderId >= 0;
    }

    public boolean isUnderReplicated() {
        return inSyncReplicas < replicas;
    }
}
