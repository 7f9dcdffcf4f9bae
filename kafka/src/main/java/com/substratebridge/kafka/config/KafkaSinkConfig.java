package com.substratebridge.kafka.config;

import com.substratebridge.core.msg.Message;
import lombok.Builder;
import lombok.Value;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.RoundRobinPartitioner;
import org.apache.kafka.common.serialization.ByteArraySerializer;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Configuration of a Kafka-backed message sink.
 */
@Value
@Builder(toBuilder = true)
public class KafkaSinkConfig {

    List<String> brokers;
    String topic;

    /**
     * Largest request the producer may send; 0 keeps the client default.
     */
    int maxMessageBytes;

    /**
     * Derives the record key. When set, records are hash-partitioned by key;
     * otherwise they are spread round-robin.
     */
    Function<? super Message, byte[]> keyFunction;

    @Builder.Default
    String requiredAcks = "all";

    @Builder.Default
    int retries = 3;

    @Builder.Default
    Duration requestTimeout = Duration.ofSeconds(60);

    /**
     * How long closing a producer session waits for in-flight sends.
     */
    @Builder.Default
    Duration closeTimeout = Duration.ofSeconds(10);

    String clientId;

    /**
     * @throws IllegalArgumentException when brokers or topic are missing
     */
    public void validate() {
        if (brokers == null || brokers.isEmpty()) {
            throw new IllegalArgumentException("At least one broker is required");
        }
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("Sink topic is required");
        }
        if (maxMessageBytes < 0) {
            throw new IllegalArgumentException("maxMessageBytes must not be negative: " + maxMessageBytes);
        }
    }

    public Map<String, Object> toProducerProperties() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, String.join(",", brokers));
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class);
        props.put(ProducerConfig.ACKS_CONFIG, requiredAcks);
        props.put(ProducerConfig.RETRIES_CONFIG, retries);
        props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, (int) requestTimeout.toMillis());
        // Must cover every attempt, kafka-clients rejects anything below request.timeout.ms
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, (int) (requestTimeout.toMillis() * (retries + 1)));
        // Idempotence keeps retried batches in order within a partition
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, isIdempotent());
        props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, isIdempotent() ? 5 : 1);

        if (maxMessageBytes > 0) {
            props.put(ProducerConfig.MAX_REQUEST_SIZE_CONFIG, maxMessageBytes);
        }
        if (keyFunction == null) {
            props.put(ProducerConfig.PARTITIONER_CLASS_CONFIG, RoundRobinPartitioner.class);
        }
        if (clientId != null) {
            props.put(ProducerConfig.CLIENT_ID_CONFIG, clientId);
        }
        return props;
    }

    private boolean isIdempotent() {
        return "all".equals(requiredAcks) && retries > 0;
    }
}
