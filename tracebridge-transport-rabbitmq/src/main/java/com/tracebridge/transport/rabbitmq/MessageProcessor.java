package com.tracebridge.transport.rabbitmq;

import com.tracebridge.trace.model.Activity;

/**
 * Application work for one delivered message. {@code activity} is the consumer activity: its
 * {@link Activity#context()} is the propagated trace context, and events added to it end up on the span.
 * Exceptions are recorded and reported by the consumer, never rethrown to the broker.
 */
@FunctionalInterface
public interface MessageProcessor {
    void process(InboundMessage message, Activity activity) throws Exception;
}
