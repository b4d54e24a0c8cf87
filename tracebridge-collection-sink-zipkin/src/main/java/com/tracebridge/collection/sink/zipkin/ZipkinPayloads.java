package com.tracebridge.collection.sink.zipkin;

import com.tracebridge.trace.model.Span;
import com.tracebridge.trace.model.SpanEvent;
import com.tracebridge.trace.model.SpanStatus;
import io.opentelemetry.api.trace.SpanKind;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

final class ZipkinPayloads {
    private ZipkinPayloads() {}

    static Map<String, Object> toZipkinSpan(Span span, String serviceName) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("traceId", span.traceId());
        root.put("id", span.spanId());
        if (span.parentSpanId() != null) root.put("parentId", span.parentSpanId());
        root.put("name", span.name());
        // zipkin has no INTERNAL kind; it is expressed by omitting the field
        if (span.kind() != null && span.kind() != SpanKind.INTERNAL) root.put("kind", span.kind().name());
        if (span.startTime() != null) root.put("timestamp", micros(span.startTime()));
        Duration duration = span.duration();
        if (duration != null) root.put("duration", Math.max(1L, TimeUnit.NANOSECONDS.toMicros(duration.toNanos())));
        root.put("localEndpoint", Map.of("serviceName", serviceName));

        Map<String, String> tags = new LinkedHashMap<>(span.tags());
        SpanStatus status = span.status();
        tags.put("otel.status_code", status.code().name());
        if (status.isError()) {
            tags.put("error", status.description() == null ? "" : status.description());
        }
        root.put("tags", tags);

        List<SpanEvent> events = span.events();
        if (!events.isEmpty()) {
            List<Map<String, Object>> annotations = new ArrayList<>(events.size());
            for (SpanEvent e : events) {
                Map<String, Object> a = new LinkedHashMap<>();
                a.put("timestamp", micros(e.timestamp()));
                a.put("value", e.name());
                annotations.add(a);
            }
            root.put("annotations", annotations);
        }
        return root;
    }

    private static long micros(Instant instant) {
        return TimeUnit.SECONDS.toMicros(instant.getEpochSecond()) + TimeUnit.NANOSECONDS.toMicros(instant.getNano());
    }
}
