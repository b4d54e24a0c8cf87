package com.tracebridge.collection.core.dispatch;

import com.tracebridge.collection.core.exporter.ExportResult;
import com.tracebridge.collection.core.exporter.SpanExporter;
import com.tracebridge.trace.model.Span;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves a slow exporter off the instrumented thread: spans are queued and handed to the delegate by a dedicated
 * daemon worker. {@link ExportResult#RETRYABLE_FAILURE} is retried up to {@code maxAttempts} times.
 */
public final class AsyncSpanExporter implements SpanExporter {
    private static final Logger log = LoggerFactory.getLogger(AsyncSpanExporter.class);

    private final SpanExporter delegate;
    private final int maxAttempts;
    private final Duration retryDelay;
    private final int capacity;
    private final LinkedBlockingDeque<Span> queue;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final Thread thread;

    public AsyncSpanExporter(SpanExporter delegate) {
        this(delegate, 3, Duration.ofMillis(500), 2048);
    }

    public AsyncSpanExporter(SpanExporter delegate, int maxAttempts, Duration retryDelay, int capacity) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.maxAttempts = Math.max(1, maxAttempts);
        this.retryDelay = Objects.requireNonNull(retryDelay, "retryDelay");
        this.capacity = capacity;
        this.queue = new LinkedBlockingDeque<>(capacity);
        this.thread = new Thread(this::run, "tracebridge-export-" + delegate.getClass().getSimpleName());
        this.thread.setDaemon(true);
        this.thread.start();
    }

    /** Accepts the span for later delivery; a full queue is reported as retryable. */
    @Override
    public ExportResult export(Span span) {
        if (!running.get() || !queue.offer(span)) {
            log.warn("Export queue for {} unavailable (capacity {}), dropping {}", delegate, capacity, span);
            return ExportResult.RETRYABLE_FAILURE;
        }
        return ExportResult.SUCCESS;
    }

    public int pending() {
        return queue.size();
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) return;
        // no interrupt: the worker notices the flag within one poll and in-flight exports complete
        try {
            thread.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
        try {
            delegate.close();
        } catch (Exception ex) {
            log.warn("Failed to close exporter {}", delegate, ex);
        }
    }

    private void run() {
        while (running.get()) {
            Span span;
            try {
                span = queue.poll(250, TimeUnit.MILLISECONDS);
            } catch (InterruptedException ie) {
                log.warn("Export worker for {} interrupted, draining {} queued span(s)", delegate, queue.size());
                break;
            }
            if (span != null) deliver(span);
        }
        Span leftover;
        while ((leftover = queue.poll()) != null) {
            deliverOnce(leftover);
        }
    }

    private void deliver(Span span) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (deliverOnce(span) == ExportResult.SUCCESS) return;
            if (attempt < maxAttempts && !pause()) return;
        }
        log.warn("Giving up on span {} after {} attempts to {}", span, maxAttempts, delegate);
    }

    private ExportResult deliverOnce(Span span) {
        try {
            return delegate.export(span);
        } catch (Exception ex) {
            log.warn("Exporter {} failed to handle span {} due to {}", delegate, span, ex.getMessage(), ex);
            return ExportResult.RETRYABLE_FAILURE;
        }
    }

    private boolean pause() {
        try {
            Thread.sleep(retryDelay.toMillis());
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public String toString() {
        return "AsyncSpanExporter[" + delegate + "]";
    }
}
