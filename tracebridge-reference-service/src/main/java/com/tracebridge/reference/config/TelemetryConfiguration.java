package com.tracebridge.reference.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracebridge.collection.core.collector.SpanCollector;
import com.tracebridge.collection.core.dispatch.AsyncSpanExporter;
import com.tracebridge.collection.core.exporter.ExporterRegistry;
import com.tracebridge.collection.core.exporter.SpanExporter;
import com.tracebridge.collection.core.source.DiagnosticSourceRegistry;
import com.tracebridge.collection.sink.zipkin.ZipkinSpanExporter;
import com.tracebridge.metrics.EnqueuedItemCounter;
import com.tracebridge.metrics.MeterProcessingErrorReporter;
import com.tracebridge.metrics.SpanMetricsExporter;
import com.tracebridge.reference.consumer.TimeApiMessageProcessor;
import com.tracebridge.reference.consumer.WebQueueConsumerService;
import com.tracebridge.transport.rabbitmq.BrokerClient;
import com.tracebridge.transport.rabbitmq.RabbitMqBrokerClient;
import com.tracebridge.transport.rabbitmq.TracingConsumer;
import com.tracebridge.transport.rabbitmq.TracingProducer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import java.net.URI;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * Wires producer, consumer and two collectors over one diagnostic source registry: a tracing collector feeding
 * the logging and Zipkin exporters, and a metrics collector feeding span timers.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
public class TelemetryConfiguration {

    @Bean(destroyMethod = "close")
    public DiagnosticSourceRegistry diagnosticSourceRegistry() {
        return new DiagnosticSourceRegistry();
    }

    @Bean
    public PrometheusMeterRegistry prometheusMeterRegistry() {
        return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "tracebridge.zipkin", name = "url")
    public AsyncSpanExporter zipkinSpanExporter(TraceBridgeProperties properties) {
        TraceBridgeProperties.Zipkin zipkin = properties.getZipkin();
        log.info("Exporting spans to Zipkin at {}", zipkin.getUrl());
        return new AsyncSpanExporter(new ZipkinSpanExporter(URI.create(zipkin.getUrl()), zipkin.getServiceName()));
    }

    @Bean(destroyMethod = "close")
    public SpanCollector tracingCollector(DiagnosticSourceRegistry registry, ObjectProvider<SpanExporter> exporters) {
        return subscribeToTransport(
                new SpanCollector("tracing", registry, tracingExporters(exporters.orderedStream().toList())));
    }

    @Bean(destroyMethod = "close")
    public SpanCollector metricsCollector(DiagnosticSourceRegistry registry, PrometheusMeterRegistry meterRegistry) {
        return subscribeToTransport(new SpanCollector(
                "metrics", registry, ExporterRegistry.of(new SpanMetricsExporter(meterRegistry))));
    }

    @Bean
    public EnqueuedItemCounter enqueuedItemCounter(PrometheusMeterRegistry meterRegistry) {
        return new EnqueuedItemCounter(meterRegistry);
    }

    @Bean
    public MeterProcessingErrorReporter processingErrorReporter(PrometheusMeterRegistry meterRegistry) {
        return new MeterProcessingErrorReporter(meterRegistry);
    }

    @Bean
    public BrokerClient brokerClient() {
        return new RabbitMqBrokerClient();
    }

    @Bean(destroyMethod = "close")
    public TracingProducer tracingProducer(
            BrokerClient brokerClient, DiagnosticSourceRegistry registry, TraceBridgeProperties properties) {
        return new TracingProducer(
                brokerClient,
                properties.getRabbitmq().getHost(),
                properties.getRabbitmq().getQueue(),
                registry.source(TracingProducer.SOURCE_NAME));
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder.build();
    }

    @Bean
    public TimeApiMessageProcessor timeApiMessageProcessor(
            RestTemplate restTemplate, ObjectMapper objectMapper, TraceBridgeProperties properties) {
        return new TimeApiMessageProcessor(restTemplate, objectMapper, properties.getApiUrl());
    }

    @Bean
    @ConditionalOnProperty(prefix = "tracebridge.consumer", name = "enabled", havingValue = "true", matchIfMissing = true)
    public WebQueueConsumerService webQueueConsumerService(
            BrokerClient brokerClient,
            DiagnosticSourceRegistry registry,
            TimeApiMessageProcessor processor,
            MeterProcessingErrorReporter errorReporter,
            TraceBridgeProperties properties) {
        TracingConsumer consumer = TracingConsumer.builder()
                .client(brokerClient)
                .host(properties.getRabbitmq().getHost())
                .queue(properties.getRabbitmq().getQueue())
                .source(registry.source(TracingConsumer.SOURCE_NAME))
                .processor(processor)
                .errorReporter(errorReporter)
                .backoff(properties.getConsumer().getBackoff())
                .stateListener(state -> log.info("Consumer for {} is {}", properties.getRabbitmq().getQueue(), state))
                .build();
        return new WebQueueConsumerService(consumer);
    }

    static ExporterRegistry tracingExporters(List<SpanExporter> exporters) {
        if (exporters.isEmpty()) {
            throw new IllegalStateException(
                    "No tracing exporter configured: enable tracebridge.logging-exporter or set tracebridge.zipkin.url");
        }
        ExporterRegistry registry = new ExporterRegistry();
        exporters.forEach(registry::register);
        log.info("Tracing exporters: {}", exporters);
        return registry;
    }

    private static SpanCollector subscribeToTransport(SpanCollector collector) {
        return collector.subscribe(TracingProducer.SOURCE_NAME).subscribe(TracingConsumer.SOURCE_NAME);
    }
}
