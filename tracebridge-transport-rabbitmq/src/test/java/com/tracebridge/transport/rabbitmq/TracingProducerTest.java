package com.tracebridge.transport.rabbitmq;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tracebridge.client.testkit.InMemorySpanExporter;
import com.tracebridge.collection.core.collector.SpanCollector;
import com.tracebridge.collection.core.exporter.ExporterRegistry;
import com.tracebridge.collection.core.source.DiagnosticSourceRegistry;
import com.tracebridge.trace.model.Span;
import com.tracebridge.trace.model.TraceContext;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TracingProducerTest {
    private final DiagnosticSourceRegistry registry = new DiagnosticSourceRegistry();
    private final InMemorySpanExporter exporter = new InMemorySpanExporter();
    private final FakeBroker broker = new FakeBroker();
    private final TracingProducer producer =
            new TracingProducer(broker, "rabbit", "webqueue", registry.source(TracingProducer.SOURCE_NAME));

    @AfterEach
    void tearDown() throws IOException {
        producer.close();
        registry.close();
    }

    private void collect() {
        new SpanCollector("tracing", registry, ExporterRegistry.of(exporter)).subscribe(TracingProducer.SOURCE_NAME);
    }

    @Test
    void injects_traceparent_matching_the_exported_producer_span() throws Exception {
        collect();

        TraceContext sent = producer.publish("{\"source\":\"web\"}");

        FakeBroker.Published published = broker.last().published.get(0);
        assertThat(published.queue()).isEqualTo("webqueue");
        assertThat(published.headers()).containsEntry(TraceHeaders.TRACEPARENT, sent.toString());
        assertThat(new String(published.body(), StandardCharsets.UTF_8)).isEqualTo("{\"source\":\"web\"}");

        assertThat(exporter.spans()).singleElement().satisfies(span -> {
            assertThat(span.name()).isEqualTo(TracingProducer.ACTIVITY_NAME);
            assertThat(span.kind()).isEqualTo(SpanKind.PRODUCER);
            assertThat(span.spanId()).isEqualTo(sent.spanId());
            assertThat(span.parentSpanId()).isNull();
            assertThat(span.tags())
                    .containsEntry("operation", "publish")
                    .containsEntry("host", "rabbit")
                    .containsEntry("queue", "webqueue");
            assertThat(span.status().code()).isEqualTo(StatusCode.OK);
        });
    }

    @Test
    void explicit_parent_continues_the_callers_trace() throws Exception {
        collect();
        TraceContext parent = TraceContext.newRoot();

        TraceContext sent = producer.publish(parent, new byte[] {1});

        assertThat(sent.traceId()).isEqualTo(parent.traceId());
        assertThat(sent.spanId()).isNotEqualTo(parent.spanId());
        assertThat(exporter.spans().get(0).parentSpanId()).isEqualTo(parent.spanId());
    }

    @Test
    void failed_publish_still_ends_the_span_with_error() throws Exception {
        collect();
        producer.publish("first");
        broker.last().publishFailure = new IOException("channel closed");

        assertThatThrownBy(() -> producer.publish("second"))
                .isInstanceOf(IOException.class)
                .hasMessage("channel closed");

        assertThat(exporter.spans()).hasSize(2);
        Span failed = exporter.spans().get(1);
        assertThat(failed.isEnded()).isTrue();
        assertThat(failed.status().isError()).isTrue();
        assertThat(failed.status().description()).contains("channel closed");
    }

    @Test
    void reconnects_after_a_failed_publish() throws Exception {
        producer.publish("first");
        broker.last().publishFailure = new IOException("channel closed");
        assertThatThrownBy(() -> producer.publish("second")).isInstanceOf(IOException.class);

        producer.publish("third");

        assertThat(broker.connections).hasSize(2);
        assertThat(broker.connections.get(0).isOpen()).isFalse();
        assertThat(broker.last().declared).containsExactly("webqueue");
    }

    @Test
    void declares_queue_once_per_connection() throws Exception {
        producer.publish("a");
        producer.publish("b");

        assertThat(broker.connects).hasValue(1);
        assertThat(broker.last().declared).containsExactly("webqueue");
        assertThat(broker.last().published).hasSize(2);
    }

    @Test
    void uninstrumented_publish_still_sends_a_fresh_context() throws Exception {
        TraceContext sent = producer.publish("a");

        assertThat(broker.last().published.get(0).headers()).containsEntry(TraceHeaders.TRACEPARENT, sent.toString());
        assertThat(sent.isSampled()).isTrue();
        assertThat(exporter.spans()).isEmpty();
    }

    @Test
    void close_releases_the_connection() throws Exception {
        producer.publish("a");

        producer.close();

        assertThat(broker.last().isOpen()).isFalse();
    }
}
