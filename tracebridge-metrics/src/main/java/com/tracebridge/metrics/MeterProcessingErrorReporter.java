package com.tracebridge.metrics;

import com.tracebridge.transport.rabbitmq.InboundMessage;
import com.tracebridge.transport.rabbitmq.ProcessingErrorReporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class MeterProcessingErrorReporter implements ProcessingErrorReporter {
    public static final String METER_NAME = "tracebridge.processing.errors";

    private final MeterRegistry meterRegistry;

    @Override
    public void report(String queue, InboundMessage message, Exception error) {
        String detail = (error.getMessage() == null || error.getMessage().isBlank())
                ? error.getClass().getSimpleName()
                : error.getMessage();
        log.warn("Failed to process message from {} ({} bytes): {}", queue, message.body().length, detail);
        Counter.builder(METER_NAME)
                .description("Messages that could not be processed")
                .tag("queue", queue)
                .tag("exception", error.getClass().getSimpleName())
                .register(meterRegistry)
                .increment();
    }
}
