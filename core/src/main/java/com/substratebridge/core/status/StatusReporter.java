package com.substratebridge.core.status;

import com.substratebridge.core.broker.IBrokerClient;
import com.substratebridge.core.broker.PartitionHealth;
import com.substratebridge.core.error.BrokerConnectivityException;
import com.substratebridge.core.msg.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregates per-partition broker health into a single verdict.
 * <p>
 * Healthy iff the topic has partitions and every partition has a leader. Under-replicated
 * partitions are reported as problems but do not fail the verdict. Nothing is cached.
 * </p>
 */
public class StatusReporter {
    private static final Logger log = LoggerFactory.getLogger(StatusReporter.class);

    private final IBrokerClient client;
    private final String topic;

    public StatusReporter(IBrokerClient client, String topic) {
        this.client = client;
        this.topic = topic;
    }

    /**
     * @return verdict, or {@link BrokerConnectivityException} when the broker cannot be reached
     */
    public Mono<Status> status() {
        return client.describePartitions(topic)
            .map(partitions -> aggregate(topic, partitions))
            .doOnNext(status -> {
                if (!status.isWorking()) {
                    log.warn("Topic {} is not healthy: {}", topic, status.getProblems());
                }
            })
            .onErrorMap(error -> BrokerConnectivityException.wrap("Cannot query partitions of topic " + topic, error));
    }

    static Status aggregate(String topic, List<PartitionHealth> partitions) {
        if (partitions.isEmpty()) {
            return Status.notWorking(List.of("no partitions found for topic " + topic));
        }

        boolean working = true;
        List<String> problems = new ArrayList<>();
        for (PartitionHealth partition : partitions) {
            if (!partition.isReachable()) {
                working = false;
                problems.add(String.format("partition %s-%d has no leader", topic, partition.getPartition()));
            } else if (partition.isUnderReplicated()) {
                problems.add(String.format("partition %s-%d is under-replicated (%d/%d in sync)",
                    topic, partition.getPartition(), partition.getInSyncReplicas(), partition.getReplicas()));
            }
        }
        return new Status(working, problems);
    }
}
