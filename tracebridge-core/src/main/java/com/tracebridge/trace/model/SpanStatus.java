package com.tracebridge.trace.model;

import io.opentelemetry.api.trace.StatusCode;
import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@EqualsAndHashCode
@ToString
public final class SpanStatus {
    private static final SpanStatus UNSET = new SpanStatus(StatusCode.UNSET, null);
    private static final SpanStatus OK = new SpanStatus(StatusCode.OK, null);

    private final StatusCode code;
    private final String description;

    private SpanStatus(StatusCode code, String description) {
        this.code = Objects.requireNonNull(code, "code");
        this.description = description;
    }

    public static SpanStatus unset() {
        return UNSET;
    }

    public static SpanStatus ok() {
        return OK;
    }

    public static SpanStatus error(String description) {
        return new SpanStatus(StatusCode.ERROR, description);
    }

    public StatusCode code() {
        return code;
    }

    /** Only set for {@link StatusCode#ERROR}. */
    public String description() {
        return description;
    }

    public boolean isError() {
        return code == StatusCode.ERROR;
    }
}
