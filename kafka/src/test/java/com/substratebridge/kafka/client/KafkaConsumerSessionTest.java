package com.substratebridge.kafka.client;

import com.substratebridge.core.broker.BrokerRecord;
import com.substratebridge.core.broker.IConsumerClient;
import com.substratebridge.core.broker.IConsumerSession;
import com.substratebridge.core.broker.PartitionHealth;
import com.substratebridge.core.metrics.SourceMetrics;
import com.substratebridge.core.msg.Message;
import com.substratebridge.core.ordered.OrderedConsumer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.kafka.receiver.ReceiverOffset;
import reactor.kafka.receiver.ReceiverRecord;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class KafkaConsumerSessionTest {

    @Test
    @DisplayName("Should acknowledge the receiver offset when the record is committed")
    void testCommitAcknowledges() {
        StubReceiverOffset receiverOffset = new StubReceiverOffset(new TopicPartition("orders", 3), 17L);
        ConsumerRecord<byte[], byte[]> consumerRecord = new ConsumerRecord<>("orders", 3, 17L,
            "k".getBytes(StandardCharsets.UTF_8), "v".getBytes(StandardCharsets.UTF_8));

        BrokerRecord record = KafkaConsumerSession.toBrokerRecord(new ReceiverRecord<>(consumerRecord, receiverOffset));

        assertEquals("k", new String(record.getKey(), StandardCharsets.UTF_8));
        assertEquals("v", new String(record.getValue(), StandardCharsets.UTF_8));
        assertEquals(3, record.getOffset().partition());
        assertEquals(17L, record.getOffset().offset());
        assertEquals(0, receiverOffset.acknowledged.get());

        record.getOffset().commit();

        assertEquals(1, receiverOffset.acknowledged.get());
    }

    @Test
    @DisplayName("Should leave the group by cancelling the record stream when the session ends")
    void testSessionEndCancelsRecordStream() {
        StubReceiverOffset receiverOffset = new StubReceiverOffset(new TopicPartition("orders", 0), 5L);
        Sinks.Many<ReceiverRecord<byte[], byte[]>> polled = Sinks.many().unicast().onBackpressureBuffer();
        AtomicBoolean streamCancelled = new AtomicBoolean();
        KafkaConsumerSession session = new KafkaConsumerSession(polled.asFlux()
            .doOnCancel(() -> streamCancelled.set(true)));
        OrderedConsumer consumer = new OrderedConsumer(new SingleSessionClient(session),
            new SourceMetrics(new SimpleMeterRegistry(), "orders", "billing"));
        Sinks.Many<Message> acks = Sinks.many().unicast().onBackpressureBuffer();

        polled.tryEmitNext(new ReceiverRecord<byte[], byte[]>(
            new ConsumerRecord<byte[], byte[]>("orders", 0, 5L, null, "v".getBytes(StandardCharsets.UTF_8)), receiverOffset));

        StepVerifier.create(consumer.consume(acks.asFlux()))
            .assertNext(acks::tryEmitNext)
            .then(() -> assertFalse(streamCancelled.get()))
            .then(acks::tryEmitComplete)
            .verifyComplete();

        assertEquals(1, receiverOffset.acknowledged.get());
        assertTrue(streamCancelled.get(), "Ending the session must cancel the receiver's record stream");
    }

    @Test
    @DisplayName("Should complete close immediately without touching the record stream")
    void testCloseHoldsNothing() {
        AtomicBoolean subscribed = new AtomicBoolean();
        KafkaConsumerSession session = new KafkaConsumerSession(Flux.<ReceiverRecord<byte[], byte[]>>never()
            .doOnSubscribe(s -> subscribed.set(true)));

        StepVerifier.create(session.close())
            .expectComplete()
            .verify(Duration.ofSeconds(1));

        assertFalse(subscribed.get());
    }

    private static final class SingleSessionClient implements IConsumerClient {
        private final IConsumerSession session;

        private SingleSessionClient(IConsumerSession session) {
            this.session = session;
        }

        @Override
        public IConsumerSession openConsumerSession() {
            return session;
        }

        @Override
        public Mono<List<PartitionHealth>> describePartitions(String topic) {
            return Mono.just(List.of());
        }

        @Override
        public void close() {
        }
    }

    private static final class StubReceiverOffset implements ReceiverOffset {
        private final TopicPartition topicPartition;
        private final long offset;
        private final AtomicInteger acknowledged = new AtomicInteger();

        private StubReceiverOffset(TopicPartition topicPartition, long offset) {
            this.topicPartition = topicPartition;
            this.offset = offset;
        }

        @Override
        public TopicPartition topicPartition() {
            return topicPartition;
        }

        @Override
        public long offset() {
            return offset;
        }

        @Override
        public void acknowledge() {
            acknowledged.incrementAndGet();
        }

        @Override
        public Mono<Void> commit() {
            return Mono.empty();
        }
    }
}
