package com.substratebridge.core.msg;

/**
 * A message that carries the partitioning key it was stored under.
 */
public interface KeyedMessage extends Message {

    /**
     * @return key bytes, or null when the message was stored without a key
     */
    byte[] getKey();
}
