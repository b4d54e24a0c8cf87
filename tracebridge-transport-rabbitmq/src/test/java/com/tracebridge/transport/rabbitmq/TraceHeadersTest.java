package com.tracebridge.transport.rabbitmq;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rabbitmq.client.impl.LongStringHelper;
import com.tracebridge.trace.model.TraceContext;
import com.tracebridge.trace.model.TraceContextFormatException;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TraceHeadersTest {

    @Test
    void injected_header_extracts_to_the_same_context() {
        TraceContext context = TraceContext.newRoot();
        Map<String, Object> headers = new HashMap<>();

        TraceHeaders.inject(headers, context);

        assertThat(headers).containsOnlyKeys("traceparent");
        assertThat(TraceHeaders.extract(headers)).isEqualTo(context);
    }

    @Test
    void missing_header_has_a_fixed_message() {
        assertThatThrownBy(() -> TraceHeaders.extract(Map.of()))
                .isInstanceOf(TraceContextFormatException.class)
                .hasMessage("Trace information not found in message");
        assertThatThrownBy(() -> TraceHeaders.extract(null)).isInstanceOf(TraceContextFormatException.class);
    }

    @Test
    void unexpected_value_type_is_rejected() {
        assertThatThrownBy(() -> TraceHeaders.extract(Map.of("traceparent", 42)))
                .isInstanceOf(TraceContextFormatException.class)
                .hasMessageContaining("java.lang.Integer");
    }

    @Test
    void rabbitmq_long_strings_are_normalized_to_text() {
        String header = "00-cd4262a7f7adf040bdd892959cf8c4fc-4a28d39ff0e725f2-01";
        Map<String, Object> raw = new HashMap<>();
        raw.put("traceparent", LongStringHelper.asLongString(header));
        raw.put("retries", 2);

        Map<String, Object> normalized = RabbitMqBrokerClient.normalizeHeaders(raw);

        assertThat(normalized).containsEntry("traceparent", header).containsEntry("retries", 2);
        assertThat(TraceHeaders.extract(normalized).spanId()).isEqualTo("4a28d39ff0e725f2");
    }
}
