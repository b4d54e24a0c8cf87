package com.tracebridge.trace.model;

import io.opentelemetry.api.trace.SpanKind;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A timed unit of work with identity, parent linkage, tags, events and status.
 *
 * <p>Lifecycle is {@code CREATED -> STARTED -> ENDED}. {@link #start()} and {@link #end(SpanStatus)} are
 * idempotent; the end listener fires exactly once. Tags, events and status can only change while the span is
 * started. Once ended the span is immutable and safe to hand to exporters on other threads.
 */
public final class Span {
    private static final Logger log = LoggerFactory.getLogger(Span.class);

    public enum State {
        CREATED,
        STARTED,
        ENDED
    }

    private final String name;
    private final SpanKind kind;
    private final TraceContext context;
    private final String parentSpanId;
    private final Clock clock;
    private final SpanEndListener endListener;

    private final Map<String, String> tags = new LinkedHashMap<>();
    private final List<SpanEvent> events = new ArrayList<>();
    private State state = State.CREATED;
    private SpanStatus status = SpanStatus.unset();
    private Instant startTime;
    private Instant endTime;

    private Span(Builder b) {
        this.name = Objects.requireNonNull(b.name, "name");
        this.kind = b.kind == null ? SpanKind.INTERNAL : b.kind;
        this.context = Objects.requireNonNull(b.context, "context");
        this.parentSpanId = b.parentSpanId;
        this.clock = b.clock == null ? Clock.systemUTC() : b.clock;
        this.endListener = b.endListener;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public synchronized Span start() {
        if (state == State.CREATED) {
            startTime = clock.instant();
            state = State.STARTED;
        }
        return this;
    }

    /** Used when the start moment was observed elsewhere, e.g. on the instrumented activity. */
    public synchronized Span startAt(Instant at) {
        if (state == State.CREATED) {
            startTime = Objects.requireNonNull(at, "at");
            state = State.STARTED;
        }
        return this;
    }

    public synchronized boolean addTag(String key, String value) {
        if (state != State.STARTED) {
            log.debug("Ignoring tag {} on span {} in state {}", key, name, state);
            return false;
        }
        if (key == null || key.isBlank() || value == null) return false;
        tags.put(key, value);
        return true;
    }

    public boolean addEvent(String eventName) {
        return addEvent(new SpanEvent(eventName, clock.instant()));
    }

    public synchronized boolean addEvent(SpanEvent event) {
        if (state != State.STARTED) {
            log.debug("Ignoring event {} on span {} in state {}", event.name(), name, state);
            return false;
        }
        events.add(event);
        return true;
    }

    public synchronized boolean setStatus(SpanStatus newStatus) {
        if (state == State.ENDED) return false;
        status = Objects.requireNonNull(newStatus, "status");
        return true;
    }

    /** Ends with the current status. */
    public boolean end() {
        SpanStatus current;
        synchronized (this) {
            current = status;
        }
        return end(current);
    }

    /**
     * @return true if this call ended the span, false if it was already ended
     */
    public boolean end(SpanStatus finalStatus) {
        synchronized (this) {
            if (state == State.ENDED) return false;
            Instant now = clock.instant();
            if (startTime == null) startTime = now;
            endTime = now.isBefore(startTime) ? startTime : now;
            status = Objects.requireNonNull(finalStatus, "status");
            state = State.ENDED;
        }
        if (endListener != null) {
            endListener.onEnd(this);
        }
        return true;
    }

    public String name() {
        return name;
    }

    public SpanKind kind() {
        return kind;
    }

    public TraceContext context() {
        return context;
    }

    public String traceId() {
        return context.traceId();
    }

    public String spanId() {
        return context.spanId();
    }

    public String parentSpanId() {
        return parentSpanId;
    }

    public boolean isSampled() {
        return context.isSampled();
    }

    public synchronized State state() {
        return state;
    }

    public synchronized boolean isEnded() {
        return state == State.ENDED;
    }

    public synchronized SpanStatus status() {
        return status;
    }

    public synchronized Map<String, String> tags() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }

    public synchronized List<SpanEvent> events() {
        return List.copyOf(events);
    }

    public synchronized Instant startTime() {
        return startTime;
    }

    public synchronized Instant endTime() {
        return endTime;
    }

    /** Null until ended. */
    public synchronized Duration duration() {
        return endTime == null ? null : Duration.between(startTime, endTime);
    }

    @Override
    public String toString() {
        return "Span[" + name + " " + kind + " trace=" + traceId() + " span=" + spanId() + " parent=" + parentSpanId
                + " " + state() + "]";
    }

    public static final class Builder {
        private final String name;
        private SpanKind kind;
        private TraceContext context;
        private String parentSpanId;
        private Clock clock;
        private SpanEndListener endListener;

        private Builder(String name) {
            this.name = name;
        }

        public Builder kind(SpanKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder context(TraceContext context) {
            this.context = context;
            return this;
        }

        /** Child of {@code parent}: same trace, fresh span id, parent reference recorded. */
        public Builder childOf(TraceContext parent) {
            this.context = TraceContext.child(parent);
            this.parentSpanId = parent.spanId();
            return this;
        }

        public Builder parentSpanId(String parentSpanId) {
            this.parentSpanId = parentSpanId;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder onEnd(SpanEndListener listener) {
            this.endListener = listener;
            return this;
        }

        public Span build() {
            if (context == null) context = TraceContext.newRoot();
            return new Span(this);
        }
    }
}
