package com.substratebridge.kafka;

import com.substratebridge.core.api.IAsyncMessageSource;
import com.substratebridge.core.broker.IConsumerClient;
import com.substratebridge.core.error.BrokerConnectivityException;
import com.substratebridge.core.metrics.SourceMetrics;
import com.substratebridge.core.msg.Message;
import com.substratebridge.core.msg.Status;
import com.substratebridge.core.ordered.OrderedConsumer;
import com.substratebridge.core.status.StatusReporter;
import com.substratebridge.kafka.client.KafkaConsumerClient;
import com.substratebridge.kafka.config.KafkaSourceConfig;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.kafka.common.KafkaException;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Message source reading one Kafka topic as a member of a consumer group.
 */
public class KafkaMessageSource implements IAsyncMessageSource {
    private static final Logger log = LoggerFactory.getLogger(KafkaMessageSource.class);

    private final IConsumerClient client;
    private final OrderedConsumer consumer;
    private final StatusReporter statusReporter;
    private final AtomicBoolean closed = new AtomicBoolean();

    public KafkaMessageSource(IConsumerClient client, String topic, SourceMetrics metrics) {
        this.client = client;
        this.consumer = new OrderedConsumer(client, metrics);
        this.statusReporter = new StatusReporter(client, topic);
    }

    /**
     * Connects a source to the configured cluster.
     *
     * @throws IllegalArgumentException     when the configuration is incomplete
     * @throws BrokerConnectivityException when the Kafka client cannot be created
     */
    public static KafkaMessageSource create(KafkaSourceConfig config, MeterRegistry registry) {
        config.validate();
        try {
            return new KafkaMessageSource(new KafkaConsumerClient(config), config.getTopic(),
                new SourceMetrics(registry, config.getTopic(), config.getConsumerGroup()));
        } catch (KafkaException e) {
            throw BrokerConnectivityException.wrap("Cannot create Kafka consumer client", e);
        }
    }

    @Override
    public Flux<Message> consumeMessages(Publisher<? extends Message> acks) {
        return consumer.consume(acks);
    }

    @Override
    public Mono<Status> status() {
        return statusReporter.status();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            client.close();
            log.info("Message source closed");
        }
    }
}
