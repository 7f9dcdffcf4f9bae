package com.substratebridge.kafka.client;

import com.substratebridge.core.broker.SendResult;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.RecordTooLargeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.kafka.sender.SenderResult;

import static org.junit.jupiter.api.Assertions.*;

class KafkaProducerSessionTest {

    @Test
    @DisplayName("Should map a confirmed send to partition and offset")
    void testSuccess() {
        Object token = new Object();
        RecordMetadata metadata = new RecordMetadata(new TopicPartition("orders", 2), 41L, 1, 0L, 3, 10);

        SendResult<Object> result = KafkaProducerSession.toSendResult(new StubSenderResult<>(metadata, null, token));

        assertTrue(result.isSuccess());
        assertSame(token, result.getCorrelationMetadata());
        assertEquals(2, result.getPartition());
        assertEquals(42L, result.getOffset());
    }

    @Test
    @DisplayName("Should keep the correlation token of a failed send")
    void testFailure() {
        Object token = new Object();
        RecordTooLargeException error = new RecordTooLargeException("too large");

        SendResult<Object> result = KafkaProducerSession.toSendResult(new StubSenderResult<>(null, error, token));

        assertFalse(result.isSuccess());
        assertSame(token, result.getCorrelationMetadata());
        assertSame(error, result.getException());
    }

    private static final class StubSenderResult<T> implements SenderResult<T> {
        private final RecordMetadata metadata;
        private final Exception exception;
        private final T correlation;

        private StubSenderResult(RecordMetadata metadata, Exception exception, T correlation) {
            this.metadata = metadata;
            this.exception = exception;
            this.correlation = correlation;
        }

        @Override
        public RecordMetadata recordMetadata() {
            return metadata;
        }

        @Override
        public Exception exception() {
            return exception;
        }

        @Override
        public T correlationMetadata() {
            return correlation;
        }
    }
}
