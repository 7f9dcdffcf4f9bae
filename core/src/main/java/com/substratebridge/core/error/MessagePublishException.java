package com.substratebridge.core.error;

import com.substratebridge.core.msg.Message;
import lombok.Getter;

/**
 * The broker reported a send failure for one specific message.
 */
@Getter
public class MessagePublishException extends BrokerConnectivityException {

    private final transient Message failedMessage;

    public MessagePublishException(Message failedMessage, Throwable cause) {
        super("Failed to publish " + failedMessage + ": " + (cause == null ? "unknown error" : cause.getMessage()), cause);
        this.failedMessage = failedMessage;
    }
}
