package com.tracebridge.trace.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class TraceContextTest {

    private static final String HEADER = "00-cd4262a7f7adf040bdd892959cf8c4fc-4a28d39ff0e725f2-01";

    @Test
    void parses_known_header() {
        TraceContext ctx = TraceContext.parse(HEADER);

        assertThat(ctx.version()).isEqualTo("00");
        assertThat(ctx.traceId()).isEqualTo("cd4262a7f7adf040bdd892959cf8c4fc");
        assertThat(ctx.spanId()).isEqualTo("4a28d39ff0e725f2");
        assertThat(ctx.isSampled()).isTrue();
        assertThat(ctx.traceIdBytes()).hasSize(16);
        assertThat(ctx.spanIdBytes()).hasSize(8);
    }

    @Test
    void format_round_trips_byte_for_byte() {
        assertThat(TraceContext.format(TraceContext.parse(HEADER))).isEqualTo(HEADER);

        String unsampled = "00-0af7651916cd43dd8448eb211c80319c-b7ad6b7169203331-00";
        TraceContext ctx = TraceContext.parse(unsampled);
        assertThat(ctx.isSampled()).isFalse();
        assertThat(ctx.toString()).isEqualTo(unsampled);
    }

    @Test
    void generated_contexts_survive_parse_format() {
        IntStream.range(0, 200).forEach(i -> {
            TraceContext ctx = i % 2 == 0 ? TraceContext.newRoot() : TraceContext.child(TraceContext.newRoot());
            assertThat(TraceContext.parse(TraceContext.format(ctx))).isEqualTo(ctx);
        });
    }

    @Test
    void new_root_is_sampled_version_zero() {
        TraceContext root = TraceContext.newRoot();

        assertThat(root.version()).isEqualTo("00");
        assertThat(root.isSampled()).isTrue();
        assertThat(root.traceId()).hasSize(32);
        assertThat(root.spanId()).hasSize(16);
        assertThat(TraceContext.newRoot().traceId()).isNotEqualTo(root.traceId());
    }

    @Test
    void child_keeps_trace_and_flags_with_new_span() {
        TraceContext parent = TraceContext.parse("00-cd4262a7f7adf040bdd892959cf8c4fc-4a28d39ff0e725f2-00");

        TraceContext child = TraceContext.child(parent);

        assertThat(child.traceId()).isEqualTo(parent.traceId());
        assertThat(child.spanId()).isNotEqualTo(parent.spanId());
        assertThat(child.isSampled()).isFalse();
    }

    @ParameterizedTest
    @ValueSource(
            strings = {
                "",
                "00-cd4262a7f7adf040bdd892959cf8c4fc-4a28d39ff0e725f2",
                "00-cd4262a7f7adf040bdd892959cf8c4f-4a28d39ff0e725f2-01",
                "00-cd4262a7f7adf040bdd892959cf8c4fc-4a28d39ff0e725f-01",
                "00-cd4262a7f7adf040bdd892959cf8c4fc-4a28d39ff0e725f2-1",
                "0-cd4262a7f7adf040bdd892959cf8c4fc-4a28d39ff0e725f2-01",
                "00-CD4262A7F7ADF040BDD892959CF8C4FC-4a28d39ff0e725f2-01",
                "00-cd4262a7f7adf040bdd892959cf8c4fz-4a28d39ff0e725f2-01",
                "00-cd4262a7f7adf040bdd892959cf8c4fc-4a28d39ff0e725g2-01",
                "00_cd4262a7f7adf040bdd892959cf8c4fc_4a28d39ff0e725f2_01",
                "00-cd4262a7f7adf040bdd892959cf8c4fc-4a28d39ff0e725f2-01-",
                " 00-cd4262a7f7adf040bdd892959cf8c4fc-4a28d39ff0e725f2-01",
                "00-00000000000000000000000000000000-4a28d39ff0e725f2-01",
                "00-cd4262a7f7adf040bdd892959cf8c4fc-0000000000000000-01"
            })
    void rejects_malformed_values(String value) {
        assertThatThrownBy(() -> TraceContext.parse(value)).isInstanceOf(TraceContextFormatException.class);
    }

    @Test
    void rejects_unsupported_version() {
        assertThatThrownBy(() -> TraceContext.parse("01-cd4262a7f7adf040bdd892959cf8c4fc-4a28d39ff0e725f2-01"))
                .isInstanceOf(TraceContextFormatException.class)
                .hasMessageContaining("version");
        assertThatThrownBy(() -> TraceContext.parse("ff-cd4262a7f7adf040bdd892959cf8c4fc-4a28d39ff0e725f2-01"))
                .isInstanceOf(TraceContextFormatException.class);
    }

    @Test
    void rejects_null() {
        assertThatThrownBy(() -> TraceContext.parse(null)).isInstanceOf(TraceContextFormatException.class);
    }

    @Test
    void of_validates_ids() {
        TraceContext ctx = TraceContext.of("cd4262a7f7adf040bdd892959cf8c4fc", "4a28d39ff0e725f2", true);
        assertThat(ctx.toString()).isEqualTo(HEADER);

        assertThatThrownBy(() -> TraceContext.of("abc", "4a28d39ff0e725f2", true))
                .isInstanceOf(TraceContextFormatException.class);
    }
}
