package com.substratebridge.kafka;

import com.substratebridge.core.api.IAsyncMessageSink;
import com.substratebridge.core.broker.IProducerClient;
import com.substratebridge.core.error.BrokerConnectivityException;
import com.substratebridge.core.metrics.SinkMetrics;
import com.substratebridge.core.msg.Message;
import com.substratebridge.core.msg.Status;
import com.substratebridge.core.ordered.OrderedPublisher;
import com.substratebridge.core.status.StatusReporter;
import com.substratebridge.kafka.client.KafkaProducerClient;
import com.substratebridge.kafka.config.KafkaSinkConfig;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.kafka.common.KafkaException;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Message sink publishing to a single Kafka topic.
 * <p>
 * Safe to share: every {@link #publishMessages} subscription runs its own producer session.
 * </p>
 */
public class KafkaMessageSink implements IAsyncMessageSink {
    private static final Logger log = LoggerFactory.getLogger(KafkaMessageSink.class);

    private final IProducerClient client;
    private final OrderedPublisher publisher;
    private final StatusReporter statusReporter;
    private final AtomicBoolean closed = new AtomicBoolean();

    public KafkaMessageSink(IProducerClient client, String topic,
                            @Nullable Function<? super Message, byte[]> keyFunction,
                            SinkMetrics metrics) {
        this.client = client;
        this.publisher = new OrderedPublisher(client, keyFunction, metrics);
        this.statusReporter = new StatusReporter(client, topic);
    }

    /**
     * Connects a sink to the configured cluster.
     *
     * @param config   sink configuration
     * @param registry registry receiving the sink's meters
     * @return sink
     * @throws IllegalArgumentException     when the configuration is incomplete
     * @throws BrokerConnectivityException when the Kafka client cannot be created
     */
    public static KafkaMessageSink create(KafkaSinkConfig config, MeterRegistry registry) {
        config.validate();
        try {
            return new KafkaMessageSink(new KafkaProducerClient(config), config.getTopic(),
                config.getKeyFunction(), new SinkMetrics(registry, config.getTopic()));
        } catch (KafkaException e) {
            throw BrokerConnectivityException.wrap("Cannot create Kafka producer client", e);
        }
    }

    @Override
    public Flux<Message> publishMessages(Publisher<? extends Message> messages) {
        return publisher.publish(messages);
    }

    @Override
    public Mono<Status> status() {
        return statusReporter.status();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            client.close();
            log.info("Message sink closed");
        }
    }
}
