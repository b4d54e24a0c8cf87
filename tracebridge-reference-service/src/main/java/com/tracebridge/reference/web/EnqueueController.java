package com.tracebridge.reference.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracebridge.metrics.EnqueuedItemCounter;
import com.tracebridge.reference.consumer.EnqueuedMessage;
import com.tracebridge.trace.model.TraceContext;
import com.tracebridge.transport.rabbitmq.TracingProducer;
import java.io.IOException;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * Front door of the sample flow.
 *
 * <ul>
 *   <li>POST /api/enqueue/{source} with optional {@code {"eventName": "..."}}: counts and publishes a message
 * </ul>
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class EnqueueController {
    private final TracingProducer producer;
    private final EnqueuedItemCounter counter;
    private final ObjectMapper objectMapper;

    public record EnqueueRequest(String eventName) {}

    @PostMapping(path = "/api/enqueue/{source}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> enqueue(
            @PathVariable("source") String source, @RequestBody(required = false) EnqueueRequest request) {
        String eventName = request == null ? null : request.eventName();
        counter.increment(source);
        try {
            byte[] body = objectMapper.writeValueAsBytes(new EnqueuedMessage(source, eventName));
            TraceContext sent = producer.publish(body);
            return Map.of("status", "enqueued", "source", source, "traceparent", sent.toString());
        } catch (IOException e) {
            log.warn("Could not enqueue message from {}: {}", source, e.toString());
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Broker unavailable", e);
        }
    }
}
