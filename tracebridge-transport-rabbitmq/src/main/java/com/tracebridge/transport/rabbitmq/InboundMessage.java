package com.tracebridge.transport.rabbitmq;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A delivered message: queue, application headers and raw body. Header values may be null. */
public record InboundMessage(String queue, Map<String, Object> headers, byte[] body) {

    public InboundMessage {
        Objects.requireNonNull(queue, "queue");
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        body = body == null ? new byte[0] : body;
    }

    public Object header(String name) {
        return headers.get(name);
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
