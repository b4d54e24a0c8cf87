package com.tracebridge.reference.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracebridge.trace.model.Activity;
import com.tracebridge.trace.model.TraceContext;
import com.tracebridge.transport.rabbitmq.InboundMessage;
import com.tracebridge.transport.rabbitmq.MessageProcessor;
import com.tracebridge.transport.rabbitmq.TraceHeaders;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.client.RestTemplate;

/**
 * Calls the time API for every message and records the message's {@code eventName} on the consumer span. The
 * outbound request carries the consumer's trace context so the downstream service joins the same trace.
 */
@Slf4j
@RequiredArgsConstructor
public class TimeApiMessageProcessor implements MessageProcessor {
    static final String TIME_PATH = "/api/time/dbtime";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String apiUrl;

    @Override
    public void process(InboundMessage message, Activity activity) throws Exception {
        TraceContext context = activity.context();
        HttpHeaders headers = new HttpHeaders();
        headers.set(TraceHeaders.TRACEPARENT, context.toString());
        String time = restTemplate
                .exchange(apiUrl + TIME_PATH, HttpMethod.GET, new HttpEntity<>(headers), String.class)
                .getBody();
        log.debug("Downstream time for trace {}: {}", context.traceId(), time);

        EnqueuedMessage payload = objectMapper.readValue(message.body(), EnqueuedMessage.class);
        if (payload.eventName() != null && !payload.eventName().isEmpty()) {
            activity.addEvent(payload.eventName());
        }
    }
}
