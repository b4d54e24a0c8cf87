package com.tracebridge.collection.sink.logging;

import com.tracebridge.collection.core.exporter.ExportResult;
import com.tracebridge.collection.core.exporter.SpanExporter;
import com.tracebridge.trace.model.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoggingSpanExporter implements SpanExporter {
    private static final Logger log = LoggerFactory.getLogger(LoggingSpanExporter.class);

    @Override
    public ExportResult export(Span span) {
        if (span == null) return ExportResult.SUCCESS;
        log.info(
                "span name={}, kind={}, traceId={}, spanId={}, parentSpanId={}, status={}, duration={}, tags={}, events={}",
                span.name(),
                span.kind(),
                span.traceId(),
                span.spanId(),
                span.parentSpanId(),
                span.status(),
                span.duration(),
                span.tags(),
                span.events());
        return ExportResult.SUCCESS;
    }

    @Override
    public String toString() {
        return "LoggingSpanExporter";
    }
}
