package com.tracebridge.collection.core.receivers;

import com.tracebridge.collection.core.source.DiagnosticEvent;
import com.tracebridge.trace.model.Activity;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/** Callback table keyed by event type. Missing callbacks are no-ops. */
public final class DiagnosticHandler {
    private final Consumer<Activity> onStart;
    private final Consumer<Activity> onStop;
    private final BiConsumer<Activity, Throwable> onException;

    private DiagnosticHandler(Builder b) {
        this.onStart = b.onStart;
        this.onStop = b.onStop;
        this.onException = b.onException;
    }

    public static Builder builder() {
        return new Builder();
    }

    public void dispatch(DiagnosticEvent event) {
        switch (event.type()) {
            case START -> onStart.accept(event.activity());
            case STOP -> onStop.accept(event.activity());
            case EXCEPTION -> onException.accept(event.activity(), event.error());
            default -> throw new IllegalStateException("Unexpected event type " + event.type());
        }
    }

    public static final class Builder {
        private Consumer<Activity> onStart = a -> {};
        private Consumer<Activity> onStop = a -> {};
        private BiConsumer<Activity, Throwable> onException = (a, e) -> {};

        public Builder onStart(Consumer<Activity> callback) {
            if (callback != null) this.onStart = callback;
            return this;
        }

        public Builder onStop(Consumer<Activity> callback) {
            if (callback != null) this.onStop = callback;
            return this;
        }

        public Builder onException(BiConsumer<Activity, Throwable> callback) {
            if (callback != null) this.onException = callback;
            return this;
        }

        public DiagnosticHandler build() {
            return new DiagnosticHandler(this);
        }
    }
}
