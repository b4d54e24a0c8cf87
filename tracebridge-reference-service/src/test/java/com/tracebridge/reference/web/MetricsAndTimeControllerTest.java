package com.tracebridge.reference.web;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tracebridge.metrics.EnqueuedItemCounter;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class MetricsAndTimeControllerTest {

    @Test
    void metrics_endpoint_serves_prometheus_text() throws Exception {
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        Clock clock = Clock.fixed(Instant.ofEpochMilli(1_758_702_600_000L), ZoneOffset.UTC);
        new EnqueuedItemCounter(registry, clock).increment("web");
        MockMvc mvc = MockMvcBuilders.standaloneSetup(new MetricsController(registry)).build();

        mvc.perform(get("/metrics"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("Enqueued_Item{Source=\"web\",} 1.0 1758702600000")));
    }

    @Test
    void time_endpoint_returns_current_instant() throws Exception {
        Clock clock = Clock.fixed(Instant.parse("2025-09-24T08:30:00Z"), ZoneOffset.UTC);
        MockMvc mvc = MockMvcBuilders.standaloneSetup(new TimeController(clock)).build();

        mvc.perform(get("/api/time/dbtime"))
                .andExpect(status().isOk())
                .andExpect(content().string("2025-09-24T08:30:00Z"));
    }
}
