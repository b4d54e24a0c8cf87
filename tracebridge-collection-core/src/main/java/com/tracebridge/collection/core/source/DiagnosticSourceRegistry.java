package com.tracebridge.collection.core.source;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owner of all {@link DiagnosticSource}s of one application. Created at startup by whoever composes the
 * collectors and closed at shutdown.
 *
 * <p>Every (source, listener) pair is announced exactly once, whether the source exists before the listener
 * subscribes or is created afterwards.
 */
public final class DiagnosticSourceRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DiagnosticSourceRegistry.class);

    private final Object lock = new Object();
    private final Map<String, DiagnosticSource> sources = new LinkedHashMap<>();
    private final List<Consumer<DiagnosticSource>> listeners = new ArrayList<>();

    /** Returns the source with this name, creating it on first use. */
    public DiagnosticSource source(String name) {
        Objects.requireNonNull(name, "name");
        DiagnosticSource created;
        List<Consumer<DiagnosticSource>> toNotify;
        synchronized (lock) {
            DiagnosticSource existing = sources.get(name);
            if (existing != null) return existing;
            created = new DiagnosticSource(name);
            sources.put(name, created);
            toNotify = List.copyOf(listeners);
        }
        log.debug("Created diagnostic source {}", name);
        toNotify.forEach(l -> announce(l, created));
        return created;
    }

    public Optional<DiagnosticSource> find(String name) {
        synchronized (lock) {
            return Optional.ofNullable(sources.get(name));
        }
    }

    public Collection<DiagnosticSource> sources() {
        synchronized (lock) {
            return List.copyOf(sources.values());
        }
    }

    /** Announces every existing source to {@code listener} now, and every future source as it is created. */
    public Subscription subscribeAll(Consumer<DiagnosticSource> listener) {
        Objects.requireNonNull(listener, "listener");
        List<DiagnosticSource> existing;
        synchronized (lock) {
            listeners.add(listener);
            existing = List.copyOf(sources.values());
        }
        existing.forEach(s -> announce(listener, s));
        return Subscription.of(() -> {
            synchronized (lock) {
                listeners.remove(listener);
            }
        });
    }

    @Override
    public void close() {
        List<DiagnosticSource> all;
        synchronized (lock) {
            listeners.clear();
            all = List.copyOf(sources.values());
            sources.clear();
        }
        all.forEach(DiagnosticSource::clear);
    }

    private static void announce(Consumer<DiagnosticSource> listener, DiagnosticSource source) {
        try {
            listener.accept(source);
        } catch (RuntimeException ex) {
            log.warn("Source listener failed for {}: {}", source.name(), ex.toString(), ex);
        }
    }
}
