package com.substratebridge.relay.config;

import com.substratebridge.core.msg.KeyedMessage;
import com.substratebridge.core.msg.Message;
import com.substratebridge.kafka.config.KafkaSinkConfig;
import com.substratebridge.kafka.config.KafkaSourceConfig;
import com.substratebridge.kafka.config.OffsetPolicy;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Configuration for the relay service, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class RelayConfig {

    String relayId;
    int httpPort;
    List<String> brokers;
    String sourceTopic;
    String sourceGroup;
    OffsetPolicy sourceOffset;
    String sinkTopic;
    int sinkMaxMessageBytes;
    boolean preserveKeys;
    long restartBaseMs;
    long restartMaxMs;

    public static RelayConfig fromEnv() {
        return fromEnv(System::getenv);
    }

    static RelayConfig fromEnv(Function<String, String> env) {
        return RelayConfig.builder()
                .relayId(getEnv(env, "RELAY_ID", "relay-1"))
                .httpPort(Integer.parseInt(getEnv(env, "HTTP_PORT", "8080")))
                .brokers(splitBrokers(getEnv(env, "KAFKA_BOOTSTRAP", "localhost:9092")))
                .sourceTopic(getEnv(env, "SOURCE_TOPIC", "substrate-in"))
                .sourceGroup(getEnv(env, "SOURCE_GROUP", "substrate-relay"))
                .sourceOffset(OffsetPolicy.valueOf(getEnv(env, "SOURCE_OFFSET", "NEWEST").toUpperCase()))
                .sinkTopic(getEnv(env, "SINK_TOPIC", "substrate-out"))
                .sinkMaxMessageBytes(Integer.parseInt(getEnv(env, "SINK_MAX_MESSAGE_BYTES", "0")))
                .preserveKeys(Boolean.parseBoolean(getEnv(env, "PRESERVE_KEYS", "true")))
                .restartBaseMs(Long.parseLong(getEnv(env, "RESTART_BASE_MS", "1000")))
                .restartMaxMs(Long.parseLong(getEnv(env, "RESTART_MAX_MS", "30000")))
                .build();
    }

    public KafkaSourceConfig toSourceConfig() {
        return KafkaSourceConfig.builder()
                .brokers(brokers)
                .topic(sourceTopic)
                .consumerGroup(sourceGroup)
                .offset(sourceOffset)
                .clientId(relayId)
                .build();
    }

    public KafkaSinkConfig toSinkConfig() {
        return KafkaSinkConfig.builder()
                .brokers(brokers)
                .topic(sinkTopic)
                .maxMessageBytes(sinkMaxMessageBytes)
                .keyFunction(preserveKeys ? RelayConfig::sourceKey : null)
                .clientId(relayId)
                .build();
    }

    public Duration getRestartBase() {
        return Duration.ofMillis(restartBaseMs);
    }

    public Duration getRestartMax() {
        return Duration.ofMillis(restartMaxMs);
    }

    static byte[] sourceKey(Message message) {
        return message instanceof KeyedMessage keyed ? keyed.getKey() : null;
    }

    private static List<String> splitBrokers(String bootstrap) {
        return Arrays.stream(bootstrap.split(","))
                .map(String::trim)
                .filter(broker -> !broker.isEmpty())
                .collect(Collectors.toList());
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String value = env.apply(key);
        return value != null ? value : defaultValue;
    }
}
