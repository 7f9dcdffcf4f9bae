package com.substratebridge.core.broker;

/**
 * Broker client able to join the configured consumer group on the configured topic.
 */
public interface IConsumerClient extends IBrokerClient {

    IConsumerSession openConsumerSession();
}
