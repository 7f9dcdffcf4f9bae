package com.substratebridge.core.broker;

/**
 * Broker client able to open producer sessions on a configured topic.
 */
public interface IProducerClient extends IBrokerClient {

    IProducerSession openProducerSession();
}
