package com.tracebridge.transport.rabbitmq;

import java.io.IOException;

/** The broker could not be reached. The consumer retries these; the producer passes them to its caller. */
public class ConnectionException extends IOException {
    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
