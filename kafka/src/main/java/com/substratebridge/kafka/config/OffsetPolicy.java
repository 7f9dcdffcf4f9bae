package com.substratebridge.kafka.config;

/**
 * Where a consumer group without committed offsets starts reading.
 */
public enum OffsetPolicy {
    /**
     * Oldest record still retained by the broker.
     */
    OLDEST("earliest"),

    /**
     * Only records produced after the group joined.
     */
    NEWEST("latest");

    private final String resetValue;

    OffsetPolicy(String resetValue) {
        this.resetValue = resetValue;
    }

    /**
     * @return value of the consumer's {@code auto.offset.reset} property
     */
    public String getResetValue() {
        return resetValue;
    }
}
