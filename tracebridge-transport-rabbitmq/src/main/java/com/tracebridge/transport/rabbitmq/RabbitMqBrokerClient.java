package com.tracebridge.transport.rabbitmq;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.LongString;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BrokerClient} over the RabbitMQ Java client. Publishes go to the default exchange with the queue name as
 * routing key. Automatic recovery is off; connection loss is reported through
 * {@link BrokerConnection#onShutdown} and the consumer reconnects.
 */
public class RabbitMqBrokerClient implements BrokerClient {
    private static final Logger log = LoggerFactory.getLogger(RabbitMqBrokerClient.class);

    private final ConnectionFactory template;
    private final String connectionName;

    public RabbitMqBrokerClient() {
        this(defaultFactory(), "tracebridge");
    }

    public RabbitMqBrokerClient(ConnectionFactory template, String connectionName) {
        this.template = Objects.requireNonNull(template, "template");
        this.connectionName = Objects.requireNonNull(connectionName, "connectionName");
    }

    @Override
    public BrokerConnection connect(String host) throws ConnectionException {
        ConnectionFactory factory = template.clone();
        factory.setHost(host);
        Connection connection;
        try {
            connection = factory.newConnection(connectionName);
        } catch (IOException | TimeoutException e) {
            throw new ConnectionException("Cannot connect to RabbitMQ at " + host, e);
        }
        try {
            Channel channel = connection.createChannel();
            if (channel == null) {
                throw new IOException("No channel available on " + host);
            }
            return new RabbitMqConnection(connection, channel);
        } catch (IOException | ShutdownSignalException e) {
            ConnectionException failure = new ConnectionException("Cannot open channel on " + host, e);
            try {
                connection.close();
            } catch (IOException | RuntimeException ex) {
                failure.addSuppressed(ex);
            }
            throw failure;
        }
    }

    private static ConnectionFactory defaultFactory() {
        ConnectionFactory factory = new ConnectionFactory();
        factory.setConnectionTimeout((int) Duration.ofSeconds(10).toMillis());
        factory.setAutomaticRecoveryEnabled(false);
        return factory;
    }

    @Override
    public String toString() {
        return "RabbitMqBrokerClient[" + template.getPort() + ", " + connectionName + "]";
    }

    static Map<String, Object> normalizeHeaders(Map<String, Object> headers) {
        if (headers == null || headers.isEmpty()) return Map.of();
        Map<String, Object> out = new LinkedHashMap<>();
        headers.forEach((k, v) -> out.put(k, v instanceof LongString ls ? ls.toString() : v));
        return out;
    }

    static final class RabbitMqConnection implements BrokerConnection {
        private final Connection connection;
        private final Channel channel;

        RabbitMqConnection(Connection connection, Channel channel) {
            this.connection = connection;
            this.channel = channel;
        }

        @Override
        public void declareQueue(String queue) throws IOException {
            try {
                channel.queueDeclare(queue, false, false, false, null);
            } catch (ShutdownSignalException e) {
                throw new IOException("Channel closed while declaring " + queue, e);
            }
        }

        @Override
        public void publish(String queue, Map<String, Object> headers, byte[] body) throws IOException {
            AMQP.BasicProperties props = new AMQP.BasicProperties.Builder()
                    .contentType("application/json")
                    .contentEncoding(StandardCharsets.UTF_8.name())
                    .headers(headers == null ? null : new LinkedHashMap<>(headers))
                    .build();
            try {
                channel.basicPublish("", queue, props, body);
            } catch (ShutdownSignalException e) {
                throw new IOException("Channel closed while publishing to " + queue, e);
            }
        }

        @Override
        public String consume(String queue, DeliveryHandler handler) throws IOException {
            Objects.requireNonNull(handler, "handler");
            DefaultConsumer consumer = new DefaultConsumer(channel) {
                @Override
                public void handleDelivery(
                        String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
                    Map<String, Object> headers = normalizeHeaders(properties == null ? null : properties.getHeaders());
                    try {
                        handler.onDelivery(new InboundMessage(queue, headers, body));
                    } catch (RuntimeException ex) {
                        // an exception escaping here would close the channel
                        log.error("Delivery handler failed on {}", queue, ex);
                    }
                }
            };
            try {
                return channel.basicConsume(queue, true, consumer);
            } catch (ShutdownSignalException e) {
                throw new IOException("Channel closed while consuming " + queue, e);
            }
        }

        @Override
        public void cancel(String consumerTag) throws IOException {
            if (!channel.isOpen()) return;
            try {
                channel.basicCancel(consumerTag);
            } catch (ShutdownSignalException e) {
                throw new IOException("Channel closed while cancelling " + consumerTag, e);
            }
        }

        @Override
        public void onShutdown(ShutdownHandler handler) {
            Objects.requireNonNull(handler, "handler");
            ShutdownListener listener = cause -> {
                if (!cause.isInitiatedByApplication()) {
                    handler.onShutdown(cause);
                }
            };
            connection.addShutdownListener(listener);
            channel.addShutdownListener(listener);
        }

        @Override
        public boolean isOpen() {
            return connection.isOpen() && channel.isOpen();
        }

        @Override
        public void close() throws IOException {
            IOException failure = null;
            try {
                if (channel.isOpen()) {
                    channel.close();
                }
            } catch (IOException | TimeoutException | RuntimeException ex) {
                failure = new IOException("Failed to close RabbitMQ channel", ex);
            }
            try {
                if (connection.isOpen()) {
                    connection.close();
                }
            } catch (IOException | RuntimeException ex) {
                if (failure == null) {
                    failure = new IOException("Failed to close RabbitMQ connection", ex);
                } else {
                    failure.addSuppressed(ex);
                }
            }
            if (failure != null) throw failure;
        }
    }
}
