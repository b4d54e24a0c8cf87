package com.tracebridge.collection.core.source;

import com.tracebridge.trace.model.Activity;
import java.util.Objects;

/**
 * One instrumentation event on a named source. The activity's id is the correlation key that ties the start,
 * exception and stop events of the same unit of work together.
 */
public record DiagnosticEvent(Type type, String sourceName, Activity activity, Throwable error) {

    public enum Type {
        START,
        STOP,
        EXCEPTION
    }

    public DiagnosticEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(activity, "activity");
    }

    public static DiagnosticEvent start(String sourceName, Activity activity) {
        return new DiagnosticEvent(Type.START, sourceName, activity, null);
    }

    public static DiagnosticEvent stop(String sourceName, Activity activity) {
        return new DiagnosticEvent(Type.STOP, sourceName, activity, null);
    }

    public static DiagnosticEvent exception(String sourceName, Activity activity, Throwable error) {
        return new DiagnosticEvent(Type.EXCEPTION, sourceName, activity, error);
    }

    public String correlationKey() {
        return activity.id();
    }
}
