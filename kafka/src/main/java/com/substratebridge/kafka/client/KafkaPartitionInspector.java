package com.substratebridge.kafka.client;

import com.substratebridge.core.broker.PartitionHealth;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.DescribeTopicsOptions;
import org.apache.kafka.clients.admin.TopicDescription;
import org.apache.kafka.common.Node;
import org.apache.kafka.common.TopicPartitionInfo;
import org.apache.kafka.common.errors.UnknownTopicOrPartitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads partition leadership and replication from the cluster through the admin API.
 */
public class KafkaPartitionInspector implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(KafkaPartitionInspector.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final AdminClient adminClient;
    private final Duration timeout;

    public KafkaPartitionInspector(AdminClient adminClient, Duration timeout) {
        this.adminClient = adminClient;
        this.timeout = timeout;
    }

    public static KafkaPartitionInspector create(List<String> brokers, @Nullable String clientId) {
        Map<String, Object> adminProps = new HashMap<>();
        adminProps.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, String.join(",", brokers));
        if (clientId != null) {
            adminProps.put(AdminClientConfig.CLIENT_ID_CONFIG, clientId + "-admin");
        }
        return new KafkaPartitionInspector(AdminClient.create(adminProps), DEFAULT_TIMEOUT);
    }

    /**
     * @param topic topic name
     * @return partition health, empty when the topic does not exist
     */
    public Mono<List<PartitionHealth>> describePartitions(String topic) {
        DescribeTopicsOptions options = new DescribeTopicsOptions().timeoutMs((int) timeout.toMillis());
        return Mono.fromFuture(() -> adminClient.describeTopics(List.of(topic), options)
                .allTopicNames()
                .toCompletionStage()
                .toCompletableFuture())
            .map(descriptions -> toPartitionHealth(descriptions.get(topic)))
            .onErrorResume(KafkaPartitionInspector::isUnknownTopic, error -> {
                log.warn("Topic {} does not exist", topic);
                return Mono.just(List.of());
            });
    }

    static List<PartitionHealth> toPartitionHealth(@Nullable TopicDescription description) {
        List<PartitionHealth> partitions = new ArrayList<>();
        if (description == null) {
            return partitions;
        }
        for (TopicPartitionInfo info : description.partitions()) {
            Node leader = info.leader();
            partitions.add(PartitionHealth.builder()
                .partition(info.partition())
                .leaderId(leader == null || leader.isEmpty() ? -1 : leader.id())
                .replicas(info.replicas().size())
                .inSyncReplicas(info.isr().size())
                .build());
        }
        return partitions;
    }

    private static boolean isUnknownTopic(Throwable error) {
        return error instanceof UnknownTopicOrPartitionException
            || error.getCause() instanceof UnknownTopicOrPartitionException;
    }

    @Override
    public void close() {
        adminClient.close(timeout);
    }
}
