package com.tracebridge.trace.model;

/** Raised when a {@code traceparent} value is malformed or carries an unsupported version. */
public class TraceContextFormatException extends IllegalArgumentException {

    public TraceContextFormatException(String message) {
        super(message);
    }

    public TraceContextFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
