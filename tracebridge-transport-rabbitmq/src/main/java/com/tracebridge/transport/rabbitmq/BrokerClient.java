package com.tracebridge.transport.rabbitmq;

/** Opens broker connections. Each call returns a fresh connection the caller owns. */
@FunctionalInterface
public interface BrokerClient {
    BrokerConnection connect(String host) throws ConnectionException;
}
