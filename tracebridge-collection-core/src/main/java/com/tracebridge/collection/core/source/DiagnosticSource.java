package com.tracebridge.collection.core.source;

import com.tracebridge.collection.core.receivers.DiagnosticHandler;
import com.tracebridge.trace.model.Activity;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named channel of start/stop/exception events. Instrumented code reports activities here and never learns who
 * listens; handler failures are logged and never reach the caller.
 */
public final class DiagnosticSource {
    private static final Logger log = LoggerFactory.getLogger(DiagnosticSource.class);

    private final String name;
    private final CopyOnWriteArrayList<DiagnosticHandler> handlers = new CopyOnWriteArrayList<>();

    DiagnosticSource(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name() {
        return name;
    }

    /** True while at least one handler is subscribed. */
    public boolean isEnabled() {
        return !handlers.isEmpty();
    }

    public Subscription subscribe(DiagnosticHandler handler) {
        Objects.requireNonNull(handler, "handler");
        handlers.add(handler);
        return Subscription.of(() -> handlers.remove(handler));
    }

    public void start(Activity activity) {
        deliver(DiagnosticEvent.start(name, activity));
    }

    public void stop(Activity activity) {
        deliver(DiagnosticEvent.stop(name, activity));
    }

    public void exception(Activity activity, Throwable error) {
        deliver(DiagnosticEvent.exception(name, activity, error));
    }

    List<DiagnosticHandler> handlers() {
        return List.copyOf(handlers);
    }

    void clear() {
        handlers.clear();
    }

    private void deliver(DiagnosticEvent event) {
        for (DiagnosticHandler h : handlers) {
            try {
                h.dispatch(event);
            } catch (RuntimeException ex) {
                log.warn(
                        "Diagnostic handler failed on source {} for {} event of {}: {}",
                        name,
                        event.type(),
                        event.activity(),
                        ex.toString(),
                        ex);
            }
        }
    }

    @Override
    public String toString() {
        return "DiagnosticSource[" + name + ", handlers=" + handlers.size() + "]";
    }
}
