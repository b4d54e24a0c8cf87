package com.tracebridge.client.testkit;

import com.tracebridge.collection.core.exporter.ExportResult;
import com.tracebridge.collection.core.exporter.SpanExporter;
import com.tracebridge.trace.model.Span;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Test double that records exported spans in memory. */
public class InMemorySpanExporter implements SpanExporter {
    private final List<Span> spans = new ArrayList<>();

    @Override
    public synchronized ExportResult export(Span span) {
        spans.add(span);
        notifyAll();
        return ExportResult.SUCCESS;
    }

    public synchronized List<Span> spans() {
        return Collections.unmodifiableList(new ArrayList<>(spans));
    }

    public synchronized void clear() {
        spans.clear();
    }

    /**
     * Blocks until at least {@code count} spans were exported or the timeout elapses.
     *
     * @return the spans recorded so far
     */
    public synchronized List<Span> awaitCount(int count, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (spans.size() < count) {
            long remainingMillis = (deadline - System.nanoTime()) / 1_000_000L;
            if (remainingMillis <= 0) break;
            wait(remainingMillis);
        }
        return spans();
    }
}
