package com.tracebridge.collection.sink.logging.autoconfigure;

import com.tracebridge.collection.sink.logging.LoggingSpanExporter;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
public class LoggingSinkAutoConfiguration {

    @Bean
    @ConditionalOnProperty(
            prefix = "tracebridge.logging-exporter",
            name = "enabled",
            havingValue = "true",
            matchIfMissing = true)
    @ConditionalOnMissingBean(LoggingSpanExporter.class)
    public LoggingSpanExporter loggingSpanExporter() {
        return new LoggingSpanExporter();
    }
}
