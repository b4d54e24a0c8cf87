package com.tracebridge.trace.model;

import io.opentelemetry.api.trace.SpanKind;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Instrumentation-side record of a unit of work, reported through a diagnostic source and turned into a
 * {@link Span} by whichever collector listens to that source.
 *
 * <p>An activity owns its identity from construction. Parent selection is explicit:
 *
 * <ul>
 *   <li>a remote parent (a context extracted from message metadata) wins;
 *   <li>otherwise an in-process parent activity, if the caller passed one;
 *   <li>otherwise a new root trace.
 * </ul>
 *
 * <p>Not thread-safe; owned by the call that created it until it is stopped.
 */
public final class Activity {
    private final String operationName;
    private final SpanKind kind;
    private final TraceContext context;
    private final String parentSpanId;
    private final Instant startTime;
    private final Map<String, String> tags = new LinkedHashMap<>();
    private final List<SpanEvent> events = new ArrayList<>();
    private final Clock clock;

    private Activity(Builder b) {
        this.operationName = Objects.requireNonNull(b.operationName, "operationName");
        this.kind = b.kind == null ? SpanKind.INTERNAL : b.kind;
        this.clock = b.clock == null ? Clock.systemUTC() : b.clock;
        if (b.remoteParent != null) {
            this.context = TraceContext.child(b.remoteParent);
            this.parentSpanId = b.remoteParent.spanId();
        } else if (b.localParent != null) {
            this.context = TraceContext.child(b.localParent.context());
            this.parentSpanId = b.localParent.context().spanId();
        } else {
            this.context = TraceContext.newRoot();
            this.parentSpanId = null;
        }
        this.startTime = clock.instant();
        this.tags.putAll(b.tags);
    }

    public static Builder builder(String operationName) {
        return new Builder(operationName);
    }

    public String operationName() {
        return operationName;
    }

    public SpanKind kind() {
        return kind;
    }

    public TraceContext context() {
        return context;
    }

    /** Correlation key shared by the start, exception and stop events of this activity. */
    public String id() {
        return context.spanId();
    }

    /** Null for a root activity. */
    public String parentSpanId() {
        return parentSpanId;
    }

    public Instant startTime() {
        return startTime;
    }

    public Activity addTag(String key, String value) {
        if (key != null && !key.isBlank() && value != null) tags.put(key, value);
        return this;
    }

    public Activity addEvent(String name) {
        if (name != null && !name.isBlank()) events.add(new SpanEvent(name, clock.instant()));
        return this;
    }

    public Map<String, String> tags() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }

    public List<SpanEvent> events() {
        return List.copyOf(events);
    }

    @Override
    public String toString() {
        return "Activity[" + operationName + " " + kind + " " + context + "]";
    }

    public static final class Builder {
        private final String operationName;
        private SpanKind kind;
        private TraceContext remoteParent;
        private Activity localParent;
        private Clock clock;
        private final Map<String, String> tags = new LinkedHashMap<>();

        private Builder(String operationName) {
            this.operationName = operationName;
        }

        public Builder kind(SpanKind kind) {
            this.kind = kind;
            return this;
        }

        /** Continue a trace received from another process. */
        public Builder remoteParent(TraceContext parent) {
            this.remoteParent = parent;
            return this;
        }

        public Builder parent(Activity parent) {
            this.localParent = parent;
            return this;
        }

        public Builder tag(String key, String value) {
            if (key != null && value != null) tags.put(key, value);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Activity build() {
            return new Activity(this);
        }
    }
}
