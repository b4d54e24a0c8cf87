package com.tracebridge.transport.rabbitmq;

import com.tracebridge.collection.core.source.DiagnosticSource;
import com.tracebridge.trace.model.Activity;
import com.tracebridge.trace.model.TraceContext;
import com.tracebridge.trace.model.TraceContextFormatException;
import io.opentelemetry.api.trace.SpanKind;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Consumes one queue and continues the trace carried by each message.
 *
 * <p>{@link #start(CancellationSignal)} retries the connection at a fixed backoff until consuming begins or
 * the signal is cancelled. Each delivery is acknowledged on receipt, reported as a consumer activity that is a
 * child of the message's {@code traceparent}, and handed to the {@link MessageProcessor} with the trace ids in
 * the MDC. Messages without a valid {@code traceparent} are reported and skipped.
 *
 * <p>A connection the broker closes while consuming puts the consumer back in the backoff loop.
 * {@link #stop()} does not wait for deliveries already being processed.
 */
public class TracingConsumer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TracingConsumer.class);

    public static final String SOURCE_NAME = "tracebridge.rabbitmq.consumer";
    public static final String ACTIVITY_NAME = "Process single RabbitMQ message";
    public static final Duration DEFAULT_BACKOFF = Duration.ofSeconds(3);

    static final String MDC_TRACE_ID = "traceId";
    static final String MDC_SPAN_ID = "spanId";
    static final String MDC_PARENT_SPAN_ID = "parentSpanId";

    private final BrokerClient client;
    private final String host;
    private final String queue;
    private final DiagnosticSource source;
    private final MessageProcessor processor;
    private final ProcessingErrorReporter errorReporter;
    private final Duration backoff;
    private final Consumer<ConsumerState> stateListener;

    private final Object lock = new Object();
    private final AtomicInteger attempts = new AtomicInteger();
    private ConsumerState state = ConsumerState.DISCONNECTED;
    private BrokerConnection connection;
    private String consumerTag;

    private TracingConsumer(Builder b) {
        this.client = Objects.requireNonNull(b.client, "client");
        this.host = Objects.requireNonNull(b.host, "host");
        this.queue = Objects.requireNonNull(b.queue, "queue");
        this.source = Objects.requireNonNull(b.source, "source");
        this.processor = Objects.requireNonNull(b.processor, "processor");
        this.errorReporter = b.errorReporter == null ? ProcessingErrorReporter.logging() : b.errorReporter;
        this.backoff = b.backoff == null ? DEFAULT_BACKOFF : b.backoff;
        this.stateListener = b.stateListener;
        if (backoff.isNegative()) {
            throw new IllegalArgumentException("backoff must not be negative: " + backoff);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Connects and starts consuming, retrying every {@code backoff} on failure. A stopped consumer starts again
     * from {@link ConsumerState#DISCONNECTED}. If the connection is lost later, the same loop resumes on a
     * reconnect thread until {@code cancellation} fires or the consumer is stopped.
     *
     * @return true once consuming, false if cancelled or stopped before that
     */
    public boolean start(CancellationSignal cancellation) {
        Objects.requireNonNull(cancellation, "cancellation");
        synchronized (lock) {
            if (state == ConsumerState.STOPPED && !cancellation.isCancelled()) {
                state = ConsumerState.DISCONNECTED;
            }
        }
        return connectLoop(cancellation);
    }

    private boolean connectLoop(CancellationSignal cancellation) {
        while (!cancellation.isCancelled()) {
            if (!transitionUnlessStopped(ConsumerState.CONNECTING)) return false;
            int attempt = attempts.incrementAndGet();
            BrokerConnection conn = null;
            String tag = null;
            try {
                conn = client.connect(host);
                BrokerConnection watched = conn;
                conn.onShutdown(cause -> onConnectionLost(watched, cause, cancellation));
                conn.declareQueue(queue);
                tag = conn.consume(queue, this::onDelivery);
                boolean stopped;
                synchronized (lock) {
                    stopped = state == ConsumerState.STOPPED;
                    if (!stopped) {
                        connection = conn;
                        consumerTag = tag;
                        state = ConsumerState.CONSUMING;
                    }
                }
                if (stopped) {
                    release(conn, tag, null);
                    return false;
                }
                notifyListener(ConsumerState.CONSUMING);
                log.info("Consuming {} on {} after {} attempt(s)", queue, host, attempt);
                return true;
            } catch (IOException | RuntimeException e) {
                release(conn, tag, e);
                log.warn(
                        "Could not consume {} on {} (attempt {}): {}; retrying in {}",
                        queue,
                        host,
                        attempt,
                        e.toString(),
                        backoff);
                log.debug("Connection failure detail", e);
                if (!transitionUnlessStopped(ConsumerState.DISCONNECTED)) return false;
                if (cancellation.await(backoff)) break;
            }
        }
        log.info("Consumer for {} cancelled before consuming started", queue);
        return false;
    }

    /** Runs on a broker thread when a connection closes without {@link #stop()} asking for it. */
    private void onConnectionLost(BrokerConnection lost, Exception cause, CancellationSignal cancellation) {
        String tag;
        synchronized (lock) {
            if (connection != lost || state != ConsumerState.CONSUMING) return;
            tag = consumerTag;
            connection = null;
            consumerTag = null;
            state = ConsumerState.DISCONNECTED;
        }
        notifyListener(ConsumerState.DISCONNECTED);
        log.warn("Lost connection to {} while consuming {}: {}; reconnecting", host, queue, String.valueOf(cause));
        release(lost, tag, null);
        if (cancellation.isCancelled()) return;
        Thread reconnect = new Thread(() -> reconnect(cancellation), "tracebridge-reconnect-" + queue);
        reconnect.setDaemon(true);
        reconnect.start();
    }

    private void reconnect(CancellationSignal cancellation) {
        if (cancellation.await(backoff)) return;
        if (!connectLoop(cancellation)) {
            log.info("Consumer for {} not reconnected", queue);
        }
    }

    /** Cancels the consumer registration and closes the connection. In-flight deliveries are not drained. */
    public void stop() {
        BrokerConnection conn;
        String tag;
        synchronized (lock) {
            if (state == ConsumerState.STOPPED) return;
            conn = connection;
            tag = consumerTag;
            connection = null;
            consumerTag = null;
        }
        transition(ConsumerState.STOPPED);
        if (conn == null) return;
        IOException failure = new IOException("Failed to stop consumer for " + queue);
        release(conn, tag, failure);
        if (failure.getSuppressed().length > 0) {
            log.warn("Consumer for {} stopped with errors", queue, failure);
        } else {
            log.info("Consumer for {} stopped", queue);
        }
    }

    @Override
    public void close() {
        stop();
    }

    public ConsumerState state() {
        synchronized (lock) {
            return state;
        }
    }

    public int attempts() {
        return attempts.get();
    }

    public String queue() {
        return queue;
    }

    void onDelivery(InboundMessage message) {
        TraceContext parent;
        try {
            parent = TraceHeaders.extract(message.headers());
        } catch (TraceContextFormatException e) {
            log.warn("Skipping message on {}: {}", queue, e.getMessage());
            report(message, e);
            return;
        }

        Activity activity = Activity.builder(ACTIVITY_NAME)
                .kind(SpanKind.CONSUMER)
                .remoteParent(parent)
                .tag("queue", queue)
                .build();
        boolean instrumented = source.isEnabled();
        if (instrumented) source.start(activity);

        String prevTraceId = MDC.get(MDC_TRACE_ID);
        String prevSpanId = MDC.get(MDC_SPAN_ID);
        String prevParentSpanId = MDC.get(MDC_PARENT_SPAN_ID);
        try {
            MDC.put(MDC_TRACE_ID, activity.context().traceId());
            MDC.put(MDC_SPAN_ID, activity.context().spanId());
            MDC.put(MDC_PARENT_SPAN_ID, activity.parentSpanId());
            processor.process(message, activity);
            if (log.isDebugEnabled()) {
                log.debug("Processed message: {}", message.bodyAsString());
            }
        } catch (Exception e) {
            if (instrumented) source.exception(activity, e);
            log.warn("Processing failed for message on {}: {}", queue, e.toString());
            report(message, e);
        } finally {
            restore(MDC_TRACE_ID, prevTraceId);
            restore(MDC_SPAN_ID, prevSpanId);
            restore(MDC_PARENT_SPAN_ID, prevParentSpanId);
            if (instrumented) source.stop(activity);
        }
    }

    private void report(InboundMessage message, Exception error) {
        try {
            errorReporter.report(queue, message, error);
        } catch (RuntimeException ex) {
            log.warn("Error reporter failed for message on {}: {}", queue, ex.toString(), ex);
        }
    }

    private boolean transitionUnlessStopped(ConsumerState next) {
        synchronized (lock) {
            if (state == ConsumerState.STOPPED) return false;
            state = next;
        }
        notifyListener(next);
        return true;
    }

    private void transition(ConsumerState next) {
        synchronized (lock) {
            state = next;
        }
        notifyListener(next);
    }

    private void notifyListener(ConsumerState next) {
        if (stateListener == null) return;
        try {
            stateListener.accept(next);
        } catch (RuntimeException ex) {
            log.warn("State listener failed on {}: {}", next, ex.toString(), ex);
        }
    }

    /** Releases a connection, attaching any failure to {@code cause} when one is given. */
    private static void release(BrokerConnection conn, String tag, Exception cause) {
        if (conn == null) return;
        if (tag != null) {
            try {
                conn.cancel(tag);
            } catch (IOException | RuntimeException ex) {
                suppress(cause, ex);
            }
        }
        try {
            conn.close();
        } catch (IOException | RuntimeException ex) {
            suppress(cause, ex);
        }
    }

    private static void suppress(Exception cause, Exception ex) {
        if (cause != null) {
            cause.addSuppressed(ex);
        } else {
            log.debug("Ignoring failure while releasing broker connection: {}", ex.toString());
        }
    }

    private static void restore(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }

    @Override
    public String toString() {
        return "TracingConsumer[" + host + " <- " + queue + ", " + state() + "]";
    }

    public static final class Builder {
        private BrokerClient client;
        private String host = "localhost";
        private String queue;
        private DiagnosticSource source;
        private MessageProcessor processor;
        private ProcessingErrorReporter errorReporter;
        private Duration backoff;
        private Consumer<ConsumerState> stateListener;

        private Builder() {}

        public Builder client(BrokerClient client) {
            this.client = client;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder queue(String queue) {
            this.queue = queue;
            return this;
        }

        public Builder source(DiagnosticSource source) {
            this.source = source;
            return this;
        }

        public Builder processor(MessageProcessor processor) {
            this.processor = processor;
            return this;
        }

        public Builder errorReporter(ProcessingErrorReporter errorReporter) {
            this.errorReporter = errorReporter;
            return this;
        }

        public Builder backoff(Duration backoff) {
            this.backoff = backoff;
            return this;
        }

        public Builder stateListener(Consumer<ConsumerState> stateListener) {
            this.stateListener = stateListener;
            return this;
        }

        public TracingConsumer build() {
            return new TracingConsumer(this);
        }
    }
}
