package com.tracebridge.reference.consumer;

import com.tracebridge.transport.rabbitmq.CancellationSignal;
import com.tracebridge.transport.rabbitmq.TracingConsumer;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

/**
 * Runs the consumer's connect loop on its own thread for the lifetime of the application context. Each start gets
 * a fresh cancellation signal, so the service can be stopped and started again.
 */
@Slf4j
public class WebQueueConsumerService implements SmartLifecycle {
    private static final Duration JOIN_TIMEOUT = Duration.ofSeconds(5);

    private final TracingConsumer consumer;
    private volatile CancellationSignal cancellation;
    private volatile Thread loop;
    private volatile boolean running;

    public WebQueueConsumerService(TracingConsumer consumer) {
        this.consumer = consumer;
    }

    @Override
    public synchronized void start() {
        if (running) return;
        if (cancellation != null) cancellation.cancel();
        CancellationSignal signal = new CancellationSignal();
        Thread thread = new Thread(() -> run(signal), "tracebridge-consumer-" + consumer.queue());
        thread.setDaemon(true);
        cancellation = signal;
        loop = thread;
        running = true;
        thread.start();
    }

    @Override
    public synchronized void stop() {
        Thread thread = loop;
        running = false;
        if (thread == null) return;
        cancellation.cancel();
        consumer.stop();
        try {
            thread.join(JOIN_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        loop = null;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public TracingConsumer consumer() {
        return consumer;
    }

    private void run(CancellationSignal signal) {
        if (!consumer.start(signal)) {
            log.info("Consumer for {} did not start", consumer.queue());
            if (!signal.isCancelled()) running = false;
        }
    }
}
