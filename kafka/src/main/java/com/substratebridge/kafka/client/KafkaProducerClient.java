package com.substratebridge.kafka.client;

import com.substratebridge.core.broker.IProducerClient;
import com.substratebridge.core.broker.IProducerSession;
import com.substratebridge.core.broker.PartitionHealth;
import com.substratebridge.kafka.config.KafkaSinkConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderOptions;

import java.util.List;

/**
 * Kafka producer side: a fresh sender per session plus a shared admin connection for status.
 */
public class KafkaProducerClient implements IProducerClient {
    private static final Logger log = LoggerFactory.getLogger(KafkaProducerClient.class);

    private final KafkaSinkConfig config;
    private final SenderOptions<byte[], byte[]> senderOptions;
    private final KafkaPartitionInspector inspector;

    public KafkaProducerClient(KafkaSinkConfig config) {
        this(config, KafkaPartitionInspector.create(config.getBrokers(), config.getClientId()));
    }

    KafkaProducerClient(KafkaSinkConfig config, KafkaPartitionInspector inspector) {
        this.config = config;
        this.inspector = inspector;
        // Per-record failures come back correlated instead of aborting the sender
        this.senderOptions = SenderOptions.<byte[], byte[]>create(config.toProducerProperties())
            .stopOnError(false)
            .closeTimeout(config.getCloseTimeout());
        log.info("Kafka producer client initialized for topic {} (brokers={})", config.getTopic(), config.getBrokers());
    }

    @Override
    public IProducerSession openProducerSession() {
        return new KafkaProducerSession(KafkaSender.create(senderOptions), config.getTopic());
    }

    @Override
    public Mono<List<PartitionHealth>> describePartitions(String topic) {
        return inspector.describePartitions(topic);
    }

    @Override
    public void close() {
        inspector.close();
        log.info("Kafka producer client closed");
    }
}
