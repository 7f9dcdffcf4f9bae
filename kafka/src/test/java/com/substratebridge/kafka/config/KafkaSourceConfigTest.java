package com.substratebridge.kafka.config;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class KafkaSourceConfigTest {

    private static KafkaSourceConfig.KafkaSourceConfigBuilder base() {
        return KafkaSourceConfig.builder()
            .brokers(List.of("kafka-1:9092"))
            .topic("orders")
            .consumerGroup("billing");
    }

    @Test
    @DisplayName("Should start from the newest offset and never auto-commit by default")
    void testDefaults() {
        KafkaSourceConfig config = base().build();
        Map<String, Object> props = config.toConsumerProperties();

        assertEquals(OffsetPolicy.NEWEST, config.getOffset());
        assertEquals("latest", props.get(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG));
        assertEquals("false", props.get(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG));
        assertEquals("billing", props.get(ConsumerConfig.GROUP_ID_CONFIG));
        assertEquals(ByteArrayDeserializer.class, props.get(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG));
        assertEquals(600_000L, props.get(ConsumerConfig.METADATA_MAX_AGE_CONFIG));
        assertEquals(Duration.ofSeconds(1), config.getCommitInterval());
        assertFalse(props.containsKey(ConsumerConfig.MAX_POLL_RECORDS_CONFIG));
    }

    @Test
    @DisplayName("Should map the oldest offset policy to earliest")
    void testOldestOffset() {
        Map<String, Object> props = base().offset(OffsetPolicy.OLDEST).build().toConsumerProperties();

        assertEquals("earliest", props.get(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG));
    }

    @Test
    @DisplayName("Should pass through metadata refresh and poll size")
    void testOverrides() {
        Map<String, Object> props = base()
            .metadataRefreshInterval(Duration.ofMinutes(1))
            .maxPollRecords(50)
            .clientId("relay-1")
            .build()
            .toConsumerProperties();

        assertEquals(60_000L, props.get(ConsumerConfig.METADATA_MAX_AGE_CONFIG));
        assertEquals(50, props.get(ConsumerConfig.MAX_POLL_RECORDS_CONFIG));
        assertEquals("relay-1", props.get(ConsumerConfig.CLIENT_ID_CONFIG));
    }

    @Test
    @DisplayName("Should require a consumer group")
    void testValidation() {
        assertDoesNotThrow(() -> base().build().validate());
        assertThrows(IllegalArgumentException.class, () -> base().consumerGroup(null).build().validate());
        assertThrows(IllegalArgumentException.class, () -> base().brokers(null).build().validate());
    }
}
