package com.tracebridge.collection.core.processor;

import com.tracebridge.collection.core.receivers.DiagnosticHandler;
import com.tracebridge.trace.model.Activity;
import com.tracebridge.trace.model.Span;
import com.tracebridge.trace.model.SpanEndListener;
import com.tracebridge.trace.model.SpanStatus;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns activity events into spans. Spans in flight are keyed by the activity id carried on every event, so
 * concurrent activities on different threads never see each other.
 */
public class SpanBridge {
    private static final Logger log = LoggerFactory.getLogger(SpanBridge.class);

    private final ConcurrentMap<String, Span> open = new ConcurrentHashMap<>();
    private final SpanEndListener onEnd;
    private final Clock clock;

    public SpanBridge(SpanEndListener onEnd) {
        this(onEnd, Clock.systemUTC());
    }

    public SpanBridge(SpanEndListener onEnd, Clock clock) {
        this.onEnd = Objects.requireNonNull(onEnd, "onEnd");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public DiagnosticHandler handler() {
        return DiagnosticHandler.builder()
                .onStart(this::onActivityStarted)
                .onStop(this::onActivityStopped)
                .onException(this::onActivityFailed)
                .build();
    }

    public void onActivityStarted(Activity activity) {
        Span span = Span.builder(activity.operationName())
                .kind(activity.kind())
                .context(activity.context())
                .parentSpanId(activity.parentSpanId())
                .clock(clock)
                .onEnd(onEnd)
                .build()
                .startAt(activity.startTime());
        activity.tags().forEach(span::addTag);
        Span previous = open.putIfAbsent(activity.id(), span);
        if (previous != null) {
            log.debug("Activity {} already started; ignoring duplicate start", activity);
        }
    }

    public void onActivityFailed(Activity activity, Throwable error) {
        Span span = open.get(activity.id());
        if (span == null) {
            log.debug("Exception reported for unknown activity {}", activity);
            return;
        }
        span.setStatus(SpanStatus.error(describe(error)));
    }

    public void onActivityStopped(Activity activity) {
        Span span = open.remove(activity.id());
        if (span == null) {
            log.debug("Stop reported for unknown activity {}", activity);
            return;
        }
        activity.tags().forEach(span::addTag);
        activity.events().forEach(span::addEvent);
        SpanStatus current = span.status();
        span.end(current.isError() ? current : SpanStatus.ok());
    }

    public int openSpans() {
        return open.size();
    }

    static String describe(Throwable error) {
        if (error == null) return "unknown error";
        return error.toString();
    }
}
