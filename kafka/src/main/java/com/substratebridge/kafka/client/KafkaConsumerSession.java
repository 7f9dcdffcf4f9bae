package com.substratebridge.kafka.client;

import com.substratebridge.core.broker.BrokerOffset;
import com.substratebridge.core.broker.BrokerRecord;
import com.substratebridge.core.broker.IConsumerSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.kafka.receiver.KafkaReceiver;
import reactor.kafka.receiver.ReceiverOffset;
import reactor.kafka.receiver.ReceiverRecord;

/**
 * One group membership, backed by the record stream of a dedicated {@link KafkaReceiver}.
 * <p>
 * The receiver creates its consumer when the stream is subscribed and leaves the group when the
 * stream terminates or is cancelled. It commits acknowledged offsets still pending on its way out,
 * on its own thread, so leaving may finish after {@link #close()} completed.
 * </p>
 */
class KafkaConsumerSession implements IConsumerSession {

    private final Flux<ReceiverRecord<byte[], byte[]>> records;

    KafkaConsumerSession(Flux<ReceiverRecord<byte[], byte[]>> records) {
        this.records = records;
    }

    @Override
    public Flux<BrokerRecord> receive() {
        return records.map(KafkaConsumerSession::toBrokerRecord);
    }

    static BrokerRecord toBrokerRecord(ReceiverRecord<byte[], byte[]> record) {
        return new BrokerRecord(record.key(), record.value(), new ReceiverBrokerOffset(record.receiverOffset()));
    }

    /**
     * Nothing beyond the record stream is held, so there is nothing left to release.
     */
    @Override
    public Mono<Void> close() {
        return Mono.empty();
    }

    private static final class ReceiverBrokerOffset implements BrokerOffset {
        private final ReceiverOffset offset;

        private ReceiverBrokerOffset(ReceiverOffset offset) {
            this.offset = offset;
        }

        @Override
        public int partition() {
            return offset.topicPartition().partition();
        }

        @Override
        public long offset() {
            return offset.offset();
        }

        /**
         * Marks the record consumed; the receiver commits marked offsets on its commit interval.
         */
        @Override
        public void commit() {
            offset.acknowledge();
        }
    }
}
