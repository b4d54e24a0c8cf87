package com.tracebridge.trace.model;

import java.time.Instant;
import java.util.Objects;

public record SpanEvent(String name, Instant timestamp) {
    public SpanEvent {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
