package com.tracebridge.collection.core.dispatch;

import static org.assertj.core.api.Assertions.assertThat;

import com.tracebridge.collection.core.exporter.ExportResult;
import com.tracebridge.collection.core.exporter.SpanExporter;
import com.tracebridge.trace.model.Span;
import com.tracebridge.trace.model.SpanStatus;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class AsyncSpanExporterTest {

    @Test
    void delivers_on_worker_thread() throws Exception {
        BlockingQueue<String> threads = new ArrayBlockingQueue<>(4);
        SpanExporter delegate = span -> {
            threads.offer(Thread.currentThread().getName());
            return ExportResult.SUCCESS;
        };
        AsyncSpanExporter async = new AsyncSpanExporter(delegate);
        try {
            assertThat(async.export(endedSpan())).isEqualTo(ExportResult.SUCCESS);

            String thread = threads.poll(2, TimeUnit.SECONDS);
            assertThat(thread).startsWith("tracebridge-export-");
        } finally {
            async.close();
        }
    }

    @Test
    void retries_retryable_failures_until_success() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        BlockingQueue<Span> delivered = new ArrayBlockingQueue<>(4);
        SpanExporter delegate = span -> {
            if (calls.incrementAndGet() < 3) return ExportResult.RETRYABLE_FAILURE;
            delivered.offer(span);
            return ExportResult.SUCCESS;
        };
        AsyncSpanExporter async = new AsyncSpanExporter(delegate, 5, Duration.ofMillis(10), 16);
        try {
            async.export(endedSpan());

            assertThat(delivered.poll(2, TimeUnit.SECONDS)).isNotNull();
            assertThat(calls).hasValue(3);
        } finally {
            async.close();
        }
    }

    @Test
    void close_delivers_spans_queued_behind_a_slow_exporter() throws Exception {
        List<Span> delivered = new CopyOnWriteArrayList<>();
        AtomicBoolean sawInterrupt = new AtomicBoolean();
        SpanExporter slow = span -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException ie) {
                sawInterrupt.set(true);
                Thread.currentThread().interrupt();
                return ExportResult.RETRYABLE_FAILURE;
            }
            delivered.add(span);
            return ExportResult.SUCCESS;
        };
        AsyncSpanExporter async = new AsyncSpanExporter(slow, 3, Duration.ofMillis(10), 64);
        for (int i = 0; i < 5; i++) {
            assertThat(async.export(endedSpan())).isEqualTo(ExportResult.SUCCESS);
        }

        async.close();

        assertThat(delivered).hasSize(5);
        assertThat(sawInterrupt).isFalse();
        assertThat(async.pending()).isZero();
    }

    @Test
    void rejects_after_close() {
        AsyncSpanExporter async = new AsyncSpanExporter(span -> ExportResult.SUCCESS);
        async.close();
        async.close();

        assertThat(async.export(endedSpan())).isEqualTo(ExportResult.RETRYABLE_FAILURE);
    }

    private static Span endedSpan() {
        Span span = Span.builder("op").build().start();
        span.end(SpanStatus.ok());
        return span;
    }
}
