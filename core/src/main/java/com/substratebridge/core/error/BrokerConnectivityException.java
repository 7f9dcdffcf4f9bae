package com.substratebridge.core.error;

/**
 * The broker could not be reached or rejected an operation.
 * <p>
 * Fatal for the running publish/consume invocation. No retry happens inside the library;
 * retrying is up to the caller (or the broker client's own configuration).
 * </p>
 */
public class BrokerConnectivityException extends SubstrateException {

    public BrokerConnectivityException(String message) {
        super(message);
    }

    public BrokerConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Classifies a failure raised by the broker client. Failures already classified pass through unchanged.
     *
     * @param context what was being attempted
     * @param error   raw failure
     * @return a {@link SubstrateException}
     */
    public static SubstrateException wrap(String context, Throwable error) {
        if (error instanceof SubstrateException substrateException) {
            return substrateException;
        }
        return new BrokerConnectivityException(context + ": " + error.getMessage(), error);
    }
}
