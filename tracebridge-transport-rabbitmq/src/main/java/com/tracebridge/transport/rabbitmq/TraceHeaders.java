package com.tracebridge.transport.rabbitmq;

import com.tracebridge.trace.model.TraceContext;
import com.tracebridge.trace.model.TraceContextFormatException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/** Carries a {@link TraceContext} in message headers under the W3C {@code traceparent} key. */
public final class TraceHeaders {
    public static final String TRACEPARENT = "traceparent";
    static final String MISSING = "Trace information not found in message";

    private TraceHeaders() {}

    public static void inject(Map<String, Object> headers, TraceContext context) {
        Objects.requireNonNull(headers, "headers");
        headers.put(TRACEPARENT, TraceContext.format(Objects.requireNonNull(context, "context")));
    }

    /**
     * Reads and parses the {@code traceparent} header. Values may arrive as {@code String} or as UTF-8
     * {@code byte[]}, depending on how the broker client decoded them.
     *
     * @throws TraceContextFormatException if the header is absent, of an unexpected type, or malformed
     */
    public static TraceContext extract(Map<String, Object> headers) {
        Object raw = headers == null ? null : headers.get(TRACEPARENT);
        if (raw == null) {
            throw new TraceContextFormatException(MISSING);
        }
        String value;
        if (raw instanceof String s) {
            value = s;
        } else if (raw instanceof byte[] bytes) {
            value = new String(bytes, StandardCharsets.UTF_8);
        } else {
            throw new TraceContextFormatException(
                    "Unsupported traceparent header type " + raw.getClass().getName());
        }
        return TraceContext.parse(value);
    }
}
