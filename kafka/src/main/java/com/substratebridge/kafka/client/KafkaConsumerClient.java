package com.substratebridge.kafka.client;

import com.substratebridge.core.broker.IConsumerClient;
import com.substratebridge.core.broker.IConsumerSession;
import com.substratebridge.core.broker.PartitionHealth;
import com.substratebridge.kafka.config.KafkaSourceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.kafka.receiver.KafkaReceiver;
import reactor.kafka.receiver.ReceiverOptions;

import java.util.Collections;
import java.util.List;

/**
 * Kafka consumer side: a fresh group member per session plus a shared admin connection for status.
 */
public class KafkaConsumerClient implements IConsumerClient {
    private static final Logger log = LoggerFactory.getLogger(KafkaConsumerClient.class);

    private final ReceiverOptions<byte[], byte[]> receiverOptions;
    private final KafkaPartitionInspector inspector;

    public KafkaConsumerClient(KafkaSourceConfig config) {
        this(config, KafkaPartitionInspector.create(config.getBrokers(), config.getClientId()));
    }

    KafkaConsumerClient(KafkaSourceConfig config, KafkaPartitionInspector inspector) {
        this.inspector = inspector;
        this.receiverOptions = ReceiverOptions.<byte[], byte[]>create(config.toConsumerProperties())
            .subscription(Collections.singleton(config.getTopic()))
            .commitInterval(config.getCommitInterval());
        log.info("Kafka consumer client initialized for topic {} (group={}, offset={})",
            config.getTopic(), config.getConsumerGroup(), config.getOffset());
    }

    @Override
    public IConsumerSession openConsumerSession() {
        return new KafkaConsumerSession(KafkaReceiver.create(receiverOptions).receive());
    }

    @Override
    public Mono<List<PartitionHealth>> describePartitions(String topic) {
        return inspector.describePartitions(topic);
    }

    @Override
    public void close() {
        inspector.close();
        log.info("Kafka consumer client closed");
    }
}
