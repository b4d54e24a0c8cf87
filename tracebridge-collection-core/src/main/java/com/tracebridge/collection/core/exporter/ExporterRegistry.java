package com.tracebridge.collection.core.exporter;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public final class ExporterRegistry {
    private final CopyOnWriteArrayList<SpanExporter> exporters = new CopyOnWriteArrayList<>();

    public ExporterRegistry register(SpanExporter exporter) {
        if (exporter != null) exporters.add(exporter);
        return this;
    }

    public List<SpanExporter> exporters() {
        return List.copyOf(exporters);
    }

    public static ExporterRegistry of(SpanExporter... exporters) {
        ExporterRegistry registry = new ExporterRegistry();
        for (SpanExporter e : exporters) registry.register(e);
        return registry;
    }
}
