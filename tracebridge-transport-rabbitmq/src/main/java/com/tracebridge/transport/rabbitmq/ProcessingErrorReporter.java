package com.tracebridge.transport.rabbitmq;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Receives messages the consumer could not process, including those rejected for bad trace headers. */
@FunctionalInterface
public interface ProcessingErrorReporter {

    void report(String queue, InboundMessage message, Exception error);

    static ProcessingErrorReporter logging() {
        Logger log = LoggerFactory.getLogger(ProcessingErrorReporter.class);
        return (queue, message, error) -> log.warn("Message on {} failed: {}", queue, error.toString());
    }
}
