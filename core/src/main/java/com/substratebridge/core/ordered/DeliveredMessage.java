package com.substratebridge.core.ordered;

import com.substratebridge.core.broker.BrokerOffset;
import com.substratebridge.core.broker.BrokerRecord;
import com.substratebridge.core.msg.KeyedMessage;

/**
 * Delivery handle wrapping one broker record.
 * <p>
 * A fresh handle is created per delivery, so a redelivered record is a different message.
 * </p>
 */
public final class DeliveredMessage implements KeyedMessage {

    private final BrokerRecord record;

    DeliveredMessage(BrokerRecord record) {
        this.record = record;
    }

    @Override
    public byte[] getData() {
        return record.getValue();
    }

    @Override
    public byte[] getKey() {
        return record.getKey();
    }

    BrokerOffset offset() {
        return record.getOffset();
    }

    @Override
    public String toString() {
        BrokerOffset offset = record.getOffset();
        return "DeliveredMessage[partition=" + offset.partition() + ", offset=" + offset.offset() + "]";
    }
}
