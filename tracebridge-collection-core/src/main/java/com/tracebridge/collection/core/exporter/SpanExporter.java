package com.tracebridge.collection.core.exporter;

import com.tracebridge.trace.model.Span;

/** Sink for completed spans. Implementations must tolerate calls from several threads. */
public interface SpanExporter extends AutoCloseable {

    ExportResult export(Span span);

    @Override
    default void close() {
        /* no-op */
    }
}
