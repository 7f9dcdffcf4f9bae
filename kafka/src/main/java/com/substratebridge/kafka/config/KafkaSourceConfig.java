package com.substratebridge.kafka.config;

import lombok.Builder;
import lombok.Value;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration of a Kafka-backed message source.
 */
@Value
@Builder(toBuilder = true)
public class KafkaSourceConfig {

    List<String> brokers;
    String topic;
    String consumerGroup;

    /**
     * Start position for a group without committed offsets.
     */
    @Builder.Default
    OffsetPolicy offset = OffsetPolicy.NEWEST;

    @Builder.Default
    Duration metadataRefreshInterval = Duration.ofMinutes(10);

    /**
     * Interval between commits of acknowledged offsets.
     */
    @Builder.Default
    Duration commitInterval = Duration.ofSeconds(1);

    /**
     * Records per poll; 0 keeps the client default.
     */
    int maxPollRecords;

    String clientId;

    /**
     * @throws IllegalArgumentException when brokers, topic or group are missing
     */
    public void validate() {
        if (brokers == null || brokers.isEmpty()) {
            throw new IllegalArgumentException("At least one broker is required");
        }
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("Source topic is required");
        }
        if (consumerGroup == null || consumerGroup.isBlank()) {
            throw new IllegalArgumentException("Consumer group is required");
        }
    }

    public Map<String, Object> toConsumerProperties() {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, String.join(",", brokers));
        props.put(ConsumerConfig.GROUP_ID_CONFIG, consumerGroup);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, offset.getResetValue());
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        props.put(ConsumerConfig.METADATA_MAX_AGE_CONFIG, metadataRefreshInterval.toMillis());

        if (maxPollRecords > 0) {
            props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, maxPollRecords);
        }
        if (clientId != null) {
            props.put(ConsumerConfig.CLIENT_ID_CONFIG, clientId);
        }
        return props;
    }
}
