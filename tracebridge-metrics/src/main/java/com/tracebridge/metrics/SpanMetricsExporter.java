package com.tracebridge.metrics;

import com.tracebridge.collection.core.exporter.ExportResult;
import com.tracebridge.collection.core.exporter.SpanExporter;
import com.tracebridge.trace.model.Span;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import lombok.RequiredArgsConstructor;

/** Records span durations as a Micrometer timer tagged by span name, kind and final status. */
@RequiredArgsConstructor
public class SpanMetricsExporter implements SpanExporter {
    public static final String METER_NAME = "tracebridge.span.duration";

    private final MeterRegistry meterRegistry;

    @Override
    public ExportResult export(Span span) {
        Duration duration = span.duration();
        if (duration == null) return ExportResult.SUCCESS;
        Timer.builder(METER_NAME)
                .description("Duration of finished spans")
                .tag("name", span.name())
                .tag("kind", span.kind().name())
                .tag("status", span.status().code().name())
                .register(meterRegistry)
                .record(duration);
        return ExportResult.SUCCESS;
    }

    @Override
    public String toString() {
        return "SpanMetricsExporter";
    }
}
