package com.substratebridge.relay.relay;

import com.substratebridge.core.api.IAsyncMessageSink;
import com.substratebridge.core.api.IAsyncMessageSource;
import com.substratebridge.core.error.BrokerConnectivityException;
import com.substratebridge.core.error.InvalidAcknowledgmentException;
import com.substratebridge.core.metrics.MetricsNames;
import com.substratebridge.core.msg.BytesMessage;
import com.substratebridge.core.msg.Message;
import com.substratebridge.core.msg.Status;
import com.substratebridge.core.util.JitterBackoff;
import com.substratebridge.relay.metrics.RelayMetrics;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class MessageRelayTest {

    private final Message m1 = BytesMessage.of("m1");
    private final Message m2 = BytesMessage.of("m2");
    private final Message m3 = BytesMessage.of("m3");
    private final Message m4 = BytesMessage.of("m4");

    private PrometheusMeterRegistry registry;
    private RelayMetrics metrics;
    private JitterBackoff backoff;

    @BeforeEach
    void setUp() {
        registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        metrics = new RelayMetrics(registry, registry, "relay-test");
        backoff = new JitterBackoff(Duration.ofMillis(10), Duration.ofMillis(50), Duration.ZERO);
    }

    @Test
    @DisplayName("Should acknowledge the source in delivery order when the sink confirms out of order")
    void testResequencesAcknowledgments() {
        ScriptedSource source = new ScriptedSource(Flux.just(m1, m2, m3, m4).concatWith(Flux.never()));
        RecordingSink sink = new RecordingSink(true);
        MessageRelay relay = new MessageRelay(source, sink, backoff, metrics);

        StepVerifier.create(relay.run())
            .expectNext(m1, m2, m3, m4)
            .thenCancel()
            .verify(Duration.ofSeconds(5));

        assertEquals(List.of(m1, m2, m3, m4), sink.published);
        assertEquals(List.of(m1, m2, m3, m4), source.acked);
        assertEquals(4.0, registry.get(MetricsNames.RELAY_RELAYED_TOTAL).counter().count());
        assertEquals(0.0, registry.get(MetricsNames.RELAY_UNCONFIRMED).gauge().value());
    }

    @Test
    @DisplayName("Should restart both sessions after a broker failure")
    void testRestartsOnBrokerFailure() {
        ScriptedSource source = new ScriptedSource(
            Flux.just(m1).concatWith(Flux.error(new BrokerConnectivityException("connection lost"))),
            Flux.just(m2, m3).concatWith(Flux.never()));
        RecordingSink sink = new RecordingSink(false);
        MessageRelay relay = new MessageRelay(source, sink, backoff, metrics);

        StepVerifier.create(relay.run())
            .expectNext(m1, m2, m3)
            .thenCancel()
            .verify(Duration.ofSeconds(5));

        assertEquals(2, source.sessions);
        assertEquals(2, sink.sessions);
        assertEquals(1.0, registry.get(MetricsNames.RELAY_RESTARTS_TOTAL).counter().count());
    }

    @Test
    @DisplayName("Should stop on an acknowledgment protocol violation")
    void testDoesNotRetryInvalidAcknowledgment() {
        ScriptedSource source = new ScriptedSource(
            Flux.error(new InvalidAcknowledgmentException(m2, m1)),
            Flux.just(m1).concatWith(Flux.never()));
        RecordingSink sink = new RecordingSink(false);
        MessageRelay relay = new MessageRelay(source, sink, backoff, metrics);

        StepVerifier.create(relay.run())
            .expectError(InvalidAcknowledgmentException.class)
            .verify(Duration.ofSeconds(5));

        assertEquals(1, source.sessions);
        assertEquals(0.0, registry.get(MetricsNames.RELAY_RESTARTS_TOTAL).counter().count());
    }

    /**
     * Plays one scripted delivery stream per consume session and records acknowledgments.
     */
    private static final class ScriptedSource implements IAsyncMessageSource {
        private final Queue<Flux<Message>> scripts = new ConcurrentLinkedQueue<>();
        private final List<Message> acked = new CopyOnWriteArrayList<>();
        private volatile int sessions;

        @SafeVarargs
        private ScriptedSource(Flux<Message>... scripts) {
            Collections.addAll(this.scripts, scripts);
        }

        @Override
        public Flux<Message> consumeMessages(Publisher<? extends Message> acks) {
            return Flux.defer(() -> {
                sessions++;
                Flux<Message> script = scripts.poll();
                if (script == null) {
                    return Flux.error(new IllegalStateException("No more scripted sessions"));
                }
                // Acks are drained before the script runs, so acknowledgments of synchronous deliveries are recorded
                return Flux.merge(Flux.<Message>from(acks).doOnNext(acked::add).ignoreElements(), script);
            });
        }

        @Override
        public Mono<Status> status() {
            return Mono.just(Status.working());
        }

        @Override
        public void close() {
        }
    }

    /**
     * Confirms everything it receives, optionally swapping each pair of confirmations.
     */
    private static final class RecordingSink implements IAsyncMessageSink {
        private final boolean swapPairs;
        private final List<Message> published = new CopyOnWriteArrayList<>();
        private volatile int sessions;

        private RecordingSink(boolean swapPairs) {
            this.swapPairs = swapPairs;
        }

        @Override
        public Flux<Message> publishMessages(Publisher<? extends Message> messages) {
            return Flux.defer(() -> {
                sessions++;
                Flux<Message> received = Flux.<Message>from(messages).doOnNext(published::add);
                if (!swapPairs) {
                    return received;
                }
                return received.buffer(2).flatMapIterable(pair -> {
                    List<Message> swapped = new ArrayList<>(pair);
                    Collections.reverse(swapped);
                    return swapped;
                });
            });
        }

        @Override
        public Mono<Status> status() {
            return Mono.just(Status.working());
        }

        @Override
        public void close() {
        }
    }
}
