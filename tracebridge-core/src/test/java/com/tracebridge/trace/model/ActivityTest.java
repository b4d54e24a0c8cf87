package com.tracebridge.trace.model;

import static org.assertj.core.api.Assertions.assertThat;

import io.opentelemetry.api.trace.SpanKind;
import org.junit.jupiter.api.Test;

class ActivityTest {

    @Test
    void remote_parent_wins_over_local_parent() {
        TraceContext remote = TraceContext.newRoot();
        Activity local = Activity.builder("outer").build();

        Activity activity = Activity.builder("inner")
                .kind(SpanKind.CONSUMER)
                .remoteParent(remote)
                .parent(local)
                .build();

        assertThat(activity.context().traceId()).isEqualTo(remote.traceId());
        assertThat(activity.parentSpanId()).isEqualTo(remote.spanId());
    }

    @Test
    void local_parent_used_when_no_remote_context() {
        Activity outer = Activity.builder("outer").build();

        Activity inner = Activity.builder("inner").parent(outer).build();

        assertThat(inner.context().traceId()).isEqualTo(outer.context().traceId());
        assertThat(inner.parentSpanId()).isEqualTo(outer.id());
        assertThat(inner.kind()).isEqualTo(SpanKind.INTERNAL);
    }

    @Test
    void no_parent_means_new_root() {
        Activity activity = Activity.builder("publish")
                .kind(SpanKind.PRODUCER)
                .tag("queue", "webqueue")
                .build()
                .addTag("host", "localhost")
                .addEvent("sent");

        assertThat(activity.parentSpanId()).isNull();
        assertThat(activity.context().isSampled()).isTrue();
        assertThat(activity.tags()).containsEntry("queue", "webqueue").containsEntry("host", "localhost");
        assertThat(activity.events()).hasSize(1);
    }
}
