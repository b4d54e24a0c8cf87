package com.tracebridge.transport.rabbitmq;

import java.io.Closeable;
import java.io.IOException;
import java.util.Map;

/**
 * One connection plus one channel. Not safe for concurrent publishes; callers serialize them or use one
 * connection per publisher.
 */
public interface BrokerConnection extends Closeable {

    /** Receives deliveries on a broker thread. Messages are acknowledged on delivery. */
    @FunctionalInterface
    interface DeliveryHandler {
        void onDelivery(InboundMessage message);
    }

    /** Told when the broker side closes the connection or channel. Not called for {@link #close()}. */
    @FunctionalInterface
    interface ShutdownHandler {
        void onShutdown(Exception cause);
    }

    void declareQueue(String queue) throws IOException;

    void publish(String queue, Map<String, Object> headers, byte[] body) throws IOException;

    /** @return the consumer tag, used to {@link #cancel(String)} the registration */
    String consume(String queue, DeliveryHandler handler) throws IOException;

    void cancel(String consumerTag) throws IOException;

    void onShutdown(ShutdownHandler handler);

    boolean isOpen();

    @Override
    void close() throws IOException;
}
