package com.substratebridge.core.msg;

/**
 * A unit of data exchanged through a sink or a source.
 * <p>
 * <b>Identity:</b> a message is identified by its reference, not by its content. Two messages with
 * identical bytes are distinct entities, and acknowledgments are matched with {@code ==}.
 * Implementations must not override {@code equals}/{@code hashCode}.
 * </p>
 */
public interface Message {

    /**
     * Payload bytes of the message.
     *
     * @return payload, never null
     */
    byte[] getData();
}
