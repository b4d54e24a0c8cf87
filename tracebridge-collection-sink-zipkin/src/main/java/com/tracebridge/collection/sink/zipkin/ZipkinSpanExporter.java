package com.tracebridge.collection.sink.zipkin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracebridge.collection.core.exporter.ExportResult;
import com.tracebridge.collection.core.exporter.SpanExporter;
import com.tracebridge.trace.model.Span;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Posts each span as a single-element Zipkin v2 JSON array, e.g. to {@code http://zipkin:9411/api/v2/spans}.
 *
 * <p>Server errors and I/O failures are retryable. Client errors are not: the same payload would be rejected
 * again, so the span is dropped with a warning.
 */
public final class ZipkinSpanExporter implements SpanExporter {
    private static final Logger log = LoggerFactory.getLogger(ZipkinSpanExporter.class);

    private final URI endpoint;
    private final String serviceName;
    private final HttpClient client;
    private final ObjectMapper json = new ObjectMapper();

    public ZipkinSpanExporter(URI endpoint, String serviceName) {
        this(
                endpoint,
                serviceName,
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build());
    }

    public ZipkinSpanExporter(URI endpoint, String serviceName, HttpClient client) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.serviceName = Objects.requireNonNull(serviceName, "serviceName");
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public ExportResult export(Span span) {
        byte[] body;
        try {
            body = encode(span);
        } catch (JsonProcessingException e) {
            log.warn("Dropping span {}: cannot serialize ({})", span, e.getOriginalMessage());
            return ExportResult.SUCCESS;
        }
        HttpRequest req = HttpRequest.newBuilder(endpoint)
                .timeout(Duration.ofSeconds(10))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();
        try {
            HttpResponse<Void> resp = client.send(req, HttpResponse.BodyHandlers.discarding());
            int status = resp.statusCode();
            if (status >= 500) {
                log.debug("Zipkin returned HTTP {} for span {}", status, span.spanId());
                return ExportResult.RETRYABLE_FAILURE;
            }
            if (status >= 400) {
                log.warn("Zipkin rejected span {} with HTTP {}; dropping it", span.spanId(), status);
            }
            return ExportResult.SUCCESS;
        } catch (IOException e) {
            log.debug("Zipkin unreachable at {}: {}", endpoint, e.toString());
            return ExportResult.RETRYABLE_FAILURE;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return ExportResult.RETRYABLE_FAILURE;
        }
    }

    byte[] encode(Span span) throws JsonProcessingException {
        return json.writeValueAsBytes(List.of(ZipkinPayloads.toZipkinSpan(span, serviceName)));
    }

    @Override
    public String toString() {
        return "ZipkinSpanExporter[" + endpoint + "]";
    }
}
