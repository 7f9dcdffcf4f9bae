package com.substratebridge.kafka.client;

import com.substratebridge.core.broker.IProducerSession;
import com.substratebridge.core.broker.OutboundRecord;
import com.substratebridge.core.broker.SendResult;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderRecord;
import reactor.kafka.sender.SenderResult;

/**
 * One {@link KafkaSender} dedicated to a single publish session.
 */
class KafkaProducerSession implements IProducerSession {

    private final KafkaSender<byte[], byte[]> sender;
    private final String topic;

    KafkaProducerSession(KafkaSender<byte[], byte[]> sender, String topic) {
        this.sender = sender;
        this.topic = topic;
    }

    @Override
    public <T> Flux<SendResult<T>> send(Publisher<OutboundRecord<T>> records) {
        Flux<SenderRecord<byte[], byte[], T>> senderRecords = Flux.from(records)
            .map(record -> SenderRecord.create(topic, null, null,
                record.getKey(), record.getValue(), record.getCorrelationMetadata()));

        return sender.send(senderRecords).map(KafkaProducerSession::toSendResult);
    }

    static <T> SendResult<T> toSendResult(SenderResult<T> result) {
        if (result.exception() != null) {
            return SendResult.failure(result.correlationMetadata(), result.exception());
        }
        RecordMetadata metadata = result.recordMetadata();
        return SendResult.success(result.correlationMetadata(), metadata.partition(), metadata.offset());
    }

    /**
     * Closing waits up to the configured close timeout for in-flight sends, off the caller's thread.
     */
    @Override
    public Mono<Void> close() {
        return Mono.<Void>fromRunnable(sender::close).subscribeOn(Schedulers.boundedElastic());
    }
}
