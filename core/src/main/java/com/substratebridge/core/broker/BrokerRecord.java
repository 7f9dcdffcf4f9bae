package com.substratebridge.core.broker;

import lombok.ToString;
import lombok.Value;

/**
 * A record received from the broker.
 */
@Value
public class BrokerRecord {

    @ToString.Exclude
    byte[] key;

    @ToString.Exclude
    byte[] value;

    BrokerOffset offset;
}
