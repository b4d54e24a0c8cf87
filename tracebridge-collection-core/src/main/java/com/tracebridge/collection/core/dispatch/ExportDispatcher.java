package com.tracebridge.collection.core.dispatch;

import com.tracebridge.collection.core.exporter.ExportResult;
import com.tracebridge.collection.core.exporter.ExporterRegistry;
import com.tracebridge.collection.core.exporter.SpanExporter;
import com.tracebridge.trace.model.Span;
import com.tracebridge.trace.model.SpanEndListener;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Fans an ended span out to every registered exporter. One failing exporter does not starve the others. */
public final class ExportDispatcher implements SpanEndListener {
    private static final Logger log = LoggerFactory.getLogger(ExportDispatcher.class);

    private final ExporterRegistry registry;

    public ExportDispatcher(ExporterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public void onEnd(Span span) {
        if (!span.isSampled()) {
            log.trace("Dropping unsampled span {}", span);
            return;
        }
        for (SpanExporter exporter : registry.exporters()) {
            try {
                ExportResult result = exporter.export(span);
                if (result != ExportResult.SUCCESS) {
                    log.warn("Exporter {} could not accept span {}: {}", exporter, span, result);
                }
            } catch (Exception ex) {
                log.warn("Exporter {} failed for span {}: {}", exporter, span, ex.toString(), ex);
            }
        }
    }
}
