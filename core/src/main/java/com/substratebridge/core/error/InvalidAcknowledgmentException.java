package com.substratebridge.core.error;

import com.substratebridge.core.msg.Message;
import lombok.Getter;

/**
 * The caller acknowledged a message that was not the oldest unacknowledged delivery.
 * <p>
 * Always a caller bug. It terminates the consumption session and is never corrected silently.
 * {@link #getExpected()} is null when no acknowledgment was expected at all.
 * </p>
 */
@Getter
public class InvalidAcknowledgmentException extends SubstrateException {

    private final transient Message acked;
    private final transient Message expected;

    public InvalidAcknowledgmentException(Message acked, Message expected) {
        super(describe(acked, expected));
        this.acked = acked;
        this.expected = expected;
    }

    private static String describe(Message acked, Message expected) {
        if (expected == null) {
            return "Unexpected acknowledgment of " + acked + ": no message awaiting acknowledgment";
        }
        return "Out of order acknowledgment: acked " + acked + " but expected " + expected;
    }
}
