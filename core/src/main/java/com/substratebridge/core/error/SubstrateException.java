package com.substratebridge.core.error;

/**
 * Base type of every failure surfaced by a sink or a source.
 * <p>
 * Cancellation is never reported through this hierarchy: a cancelled publish or consume
 * simply ends without a terminal error signal.
 * </p>
 */
public abstract class SubstrateException extends RuntimeException {

    protected SubstrateException(String message) {
        super(message);
    }

    protected SubstrateException(String message, Throwable cause) {
        super(message, cause);
    }
}
