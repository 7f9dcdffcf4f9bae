package com.substratebridge.core.broker;

import lombok.Value;

/**
 * Outcome of one send, carrying the correlation metadata of its {@link OutboundRecord}.
 *
 * @param <T> type of the correlation metadata
 */
@Value
public class SendResult<T> {

    T correlationMetadata;

    /**
     * Partition the record landed on, -1 on failure.
     */
    int partition;

    /**
     * Offset the record landed at, -1 on failure.
     */
    long offset;

    /**
     * Null on success.
     */
    Throwable exception;

    public static <T> SendResult<T> success(T correlationMetadata, int partition, long offset) {
        return new SendResult<>(correlationMetadata, partition, offset, null);
    }

    public static <T> SendResult<T> failure(T correlationMetadata, Throwable exception) {
        return new SendResult<>(correlationMetadata, -1, -1L, exception);
    }

    public boolean isSuccess() {
        return exception == null;
    }
}
