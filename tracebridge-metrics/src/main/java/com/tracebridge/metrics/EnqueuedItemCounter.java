package com.tracebridge.metrics;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.prometheus.client.Collector;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts items accepted for enqueueing, per originating source.
 *
 * <p>On a {@link PrometheusMeterRegistry} the series is scraped as {@code Enqueued_Item{Source="web",} 2.0
 * <ms>}: the bare metric name and the time of the last increment, with no {@code _total} suffix. Other registries
 * get a Micrometer {@link FunctionCounter} of the same name and tag.
 */
public class EnqueuedItemCounter {
    public static final String METER_NAME = "Enqueued_Item";
    public static final String SOURCE_TAG = "Source";
    static final String DESCRIPTION = "Items enqueued for processing";

    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Map<String, SourceCount> counts = new ConcurrentHashMap<>();

    public EnqueuedItemCounter(MeterRegistry meterRegistry) {
        this(meterRegistry, Clock.systemUTC());
    }

    public EnqueuedItemCounter(MeterRegistry meterRegistry, Clock clock) {
        Objects.requireNonNull(meterRegistry, "meterRegistry");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (meterRegistry instanceof PrometheusMeterRegistry prometheus) {
            prometheus.getPrometheusRegistry().register(new ExpositionCollector());
            this.meterRegistry = null;
        } else {
            this.meterRegistry = meterRegistry;
        }
    }

    public void increment(String source) {
        String tag = source == null || source.isBlank() ? "unknown" : source;
        counts.computeIfAbsent(tag, this::newSource).increment(clock.millis());
    }

    public long count(String source) {
        SourceCount count = counts.get(source);
        return count == null ? 0 : count.value.get();
    }

    private SourceCount newSource(String source) {
        SourceCount count = new SourceCount();
        if (meterRegistry != null) {
            FunctionCounter.builder(METER_NAME, count, c -> c.value.get())
                    .description(DESCRIPTION)
                    .tag(SOURCE_TAG, source)
                    .register(meterRegistry);
        }
        return count;
    }

    private static final class SourceCount {
        final AtomicLong value = new AtomicLong();
        volatile long updatedAtMillis;

        synchronized void increment(long nowMillis) {
            value.incrementAndGet();
            updatedAtMillis = nowMillis;
        }

        synchronized long[] snapshot() {
            return new long[] {value.get(), updatedAtMillis};
        }
    }

    /** Untyped family so the text format keeps the metric name as is and carries a sample timestamp. */
    private final class ExpositionCollector extends Collector {
        @Override
        public List<MetricFamilySamples> collect() {
            List<MetricFamilySamples.Sample> samples = new ArrayList<>(counts.size());
            counts.forEach((source, count) -> {
                long[] snapshot = count.snapshot();
                samples.add(new MetricFamilySamples.Sample(
                        METER_NAME, List.of(SOURCE_TAG), List.of(source), snapshot[0], snapshot[1]));
            });
            return List.of(new MetricFamilySamples(METER_NAME, Type.UNKNOWN, DESCRIPTION, samples));
        }
    }
}
