package com.tracebridge.transport.rabbitmq;

import com.tracebridge.collection.core.source.DiagnosticSource;
import com.tracebridge.trace.model.Activity;
import com.tracebridge.trace.model.TraceContext;
import io.opentelemetry.api.trace.SpanKind;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes to one queue with a {@code traceparent} header. When its diagnostic source has listeners, each
 * publish is reported as a producer activity whose context is the one written to the header.
 *
 * <p>Owns one lazily opened connection; publishes are serialized on it.
 */
public class TracingProducer implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(TracingProducer.class);

    public static final String SOURCE_NAME = "tracebridge.rabbitmq.producer";
    public static final String ACTIVITY_NAME = "Publish to RabbitMQ";

    private final BrokerClient client;
    private final String host;
    private final String queue;
    private final DiagnosticSource source;

    private BrokerConnection connection;
    private boolean queueDeclared;

    public TracingProducer(BrokerClient client, String host, String queue, DiagnosticSource source) {
        this.client = Objects.requireNonNull(client, "client");
        this.host = Objects.requireNonNull(host, "host");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.source = Objects.requireNonNull(source, "source");
    }

    public TraceContext publish(String body) throws IOException {
        return publish(null, body.getBytes(StandardCharsets.UTF_8));
    }

    public TraceContext publish(byte[] body) throws IOException {
        return publish(null, body);
    }

    /**
     * @param parent context of the caller's work, or null to start a new trace
     * @return the context sent in the {@code traceparent} header
     */
    public synchronized TraceContext publish(TraceContext parent, byte[] body) throws IOException {
        Objects.requireNonNull(body, "body");
        Activity activity = null;
        if (source.isEnabled()) {
            activity = Activity.builder(ACTIVITY_NAME)
                    .kind(SpanKind.PRODUCER)
                    .remoteParent(parent)
                    .tag("operation", "publish")
                    .tag("host", host)
                    .tag("queue", queue)
                    .build();
            source.start(activity);
        }
        TraceContext sent;
        if (activity != null) {
            sent = activity.context();
        } else {
            sent = parent == null ? TraceContext.newRoot() : TraceContext.child(parent);
        }
        Map<String, Object> headers = new HashMap<>();
        TraceHeaders.inject(headers, sent);
        try {
            openConnection().publish(queue, headers, body);
            log.debug("Published {} bytes to {} with traceparent {}", body.length, queue, sent);
            return sent;
        } catch (IOException | RuntimeException e) {
            if (activity != null) source.exception(activity, e);
            dropConnection();
            throw e;
        } finally {
            if (activity != null) source.stop(activity);
        }
    }

    @Override
    public synchronized void close() throws IOException {
        BrokerConnection current = connection;
        connection = null;
        queueDeclared = false;
        if (current != null) {
            current.close();
        }
    }

    private BrokerConnection openConnection() throws IOException {
        if (connection == null || !connection.isOpen()) {
            dropConnection();
            connection = client.connect(host);
        }
        if (!queueDeclared) {
            connection.declareQueue(queue);
            queueDeclared = true;
        }
        return connection;
    }

    private void dropConnection() {
        BrokerConnection current = connection;
        connection = null;
        queueDeclared = false;
        if (current == null) return;
        try {
            current.close();
        } catch (IOException | RuntimeException ex) {
            log.debug("Ignoring failure while closing broker connection: {}", ex.toString());
        }
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "TracingProducer[%s -> %s]", host, queue);
    }
}
