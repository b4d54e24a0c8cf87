package com.tracebridge.collection.core.collector;

import com.tracebridge.collection.core.dispatch.ExportDispatcher;
import com.tracebridge.collection.core.exporter.ExporterRegistry;
import com.tracebridge.collection.core.processor.SpanBridge;
import com.tracebridge.collection.core.receivers.DiagnosticHandler;
import com.tracebridge.collection.core.source.DiagnosticSource;
import com.tracebridge.collection.core.source.DiagnosticSourceRegistry;
import com.tracebridge.collection.core.source.Subscription;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bridges the diagnostic sources it is told about to spans and exporters.
 *
 * <p>The collector listens to the whole registry but only attaches to sources whose name was passed to
 * {@link #subscribe(String)}. Several collectors can watch the same registry independently, typically one per
 * exporter family.
 */
public final class SpanCollector implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SpanCollector.class);

    private final String name;
    private final DiagnosticSourceRegistry registry;
    private final SpanBridge bridge;
    private final Object lock = new Object();
    private final Map<String, DiagnosticHandler> handlersBySource = new LinkedHashMap<>();
    private final Set<String> attached = new HashSet<>();
    private final List<Subscription> listenerSubscriptions = new ArrayList<>();
    private final AtomicBoolean disposed = new AtomicBoolean();
    private final Subscription allSourcesSubscription;

    public SpanCollector(String name, DiagnosticSourceRegistry registry, ExporterRegistry exporters) {
        this(name, registry, new SpanBridge(new ExportDispatcher(exporters)));
    }

    public SpanCollector(String name, DiagnosticSourceRegistry registry, SpanBridge bridge) {
        this.name = Objects.requireNonNull(name, "name");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.bridge = Objects.requireNonNull(bridge, "bridge");
        this.allSourcesSubscription = registry.subscribeAll(this::onSourceAvailable);
    }

    public SpanCollector subscribe(String sourceName) {
        return subscribe(sourceName, bridge.handler());
    }

    public SpanCollector subscribe(String sourceName, DiagnosticHandler handler) {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(handler, "handler");
        if (disposed.get()) {
            throw new IllegalStateException("Collector " + name + " is disposed");
        }
        synchronized (lock) {
            handlersBySource.putIfAbsent(sourceName, handler);
        }
        registry.find(sourceName).ifPresent(this::onSourceAvailable);
        return this;
    }

    public String name() {
        return name;
    }

    public SpanBridge bridge() {
        return bridge;
    }

    public int activeSubscriptions() {
        synchronized (lock) {
            return listenerSubscriptions.size();
        }
    }

    public boolean isDisposed() {
        return disposed.get();
    }

    /**
     * Detaches every handler and releases the registry-wide subscription. Safe to call repeatedly and from
     * several threads; only the first call tears down.
     *
     * @return true if this call performed the teardown
     */
    public boolean dispose() {
        if (!disposed.compareAndSet(false, true)) {
            return false;
        }
        List<Subscription> toClose;
        synchronized (lock) {
            toClose = new ArrayList<>(listenerSubscriptions);
            listenerSubscriptions.clear();
            attached.clear();
        }
        toClose.forEach(SpanCollector::closeQuietly);
        closeQuietly(allSourcesSubscription);
        log.debug("Collector {} disposed ({} subscriptions released)", name, toClose.size());
        return true;
    }

    @Override
    public void close() {
        dispose();
    }

    private void onSourceAvailable(DiagnosticSource source) {
        if (disposed.get()) return;
        DiagnosticHandler handler;
        synchronized (lock) {
            handler = handlersBySource.get(source.name());
            if (handler == null || !attached.add(source.name())) return;
        }
        Subscription subscription = source.subscribe(handler);
        boolean keep;
        synchronized (lock) {
            keep = !disposed.get();
            if (keep) listenerSubscriptions.add(subscription);
        }
        if (!keep) {
            subscription.close();
            return;
        }
        log.debug("Collector {} attached to source {}", name, source.name());
    }

    private static void closeQuietly(Subscription subscription) {
        try {
            subscription.close();
        } catch (RuntimeException ex) {
            log.debug("Ignoring failure while releasing subscription: {}", ex.toString());
        }
    }

    @Override
    public String toString() {
        return "SpanCollector[" + name + "]";
    }
}
