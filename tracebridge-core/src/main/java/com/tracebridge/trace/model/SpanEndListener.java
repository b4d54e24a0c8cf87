package com.tracebridge.trace.model;

/** Notified once, right after a span transitions to {@link Span.State#ENDED}. */
@FunctionalInterface
public interface SpanEndListener {
    void onEnd(Span span);
}
