package com.substratebridge.kafka;

import com.substratebridge.core.broker.IProducerClient;
import com.substratebridge.core.broker.IProducerSession;
import com.substratebridge.core.broker.OutboundRecord;
import com.substratebridge.core.broker.PartitionHealth;
import com.substratebridge.core.broker.SendResult;
import com.substratebridge.core.metrics.SinkMetrics;
import com.substratebridge.core.msg.BytesMessage;
import com.substratebridge.core.msg.Message;
import com.substratebridge.kafka.config.KafkaSinkConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class KafkaMessageSinkTest {

    @Test
    @DisplayName("Should publish through the client and acknowledge the same references")
    void testPublish() {
        EchoProducerClient client = new EchoProducerClient();
        KafkaMessageSink sink = new KafkaMessageSink(client, "orders", null,
            new SinkMetrics(new SimpleMeterRegistry(), "orders"));
        Message message = BytesMessage.of("hello");

        StepVerifier.create(sink.publishMessages(Flux.just(message)))
            .assertNext(ack -> assertSame(message, ack))
            .verifyComplete();
    }

    @Test
    @DisplayName("Should report the topic status and close the client once")
    void testStatusAndClose() {
        EchoProducerClient client = new EchoProducerClient();
        KafkaMessageSink sink = new KafkaMessageSink(client, "orders", null,
            new SinkMetrics(new SimpleMeterRegistry(), "orders"));

        StepVerifier.create(sink.status())
            .assertNext(status -> assertTrue(status.isWorking()))
            .verifyComplete();

        sink.close();
        sink.close();
        assertEquals(1, client.closes.get());
    }

    @Test
    @DisplayName("Should reject an incomplete configuration before connecting")
    void testCreateValidates() {
        KafkaSinkConfig config = KafkaSinkConfig.builder().brokers(List.of("localhost:9092")).build();

        assertThrows(IllegalArgumentException.class, () -> KafkaMessageSink.create(config, new SimpleMeterRegistry()));
    }

    private static final class EchoProducerClient implements IProducerClient {
        private final AtomicInteger closes = new AtomicInteger();

        @Override
        public IProducerSession openProducerSession() {
            return new IProducerSession() {
                @Override
                public <T> Flux<SendResult<T>> send(Publisher<OutboundRecord<T>> records) {
                    AtomicInteger offsets = new AtomicInteger();
                    return Flux.from(records)
                        .map(record -> SendResult.success(record.getCorrelationMetadata(), 0, offsets.getAndIncrement()));
                }

                @Override
                public Mono<Void> close() {
                    return Mono.empty();
                }
            };
        }

        @Override
        public Mono<List<PartitionHealth>> describePartitions(String topic) {
            return Mono.just(List.of(PartitionHealth.builder().partition(0).leaderId(1).replicas(1).inSyncReplicas(1).build()));
        }

        @Override
        public void close() {
            closes.incrementAndGet();
        }
    }
}
