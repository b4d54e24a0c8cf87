package com.tracebridge.reference.consumer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Body published by the enqueue endpoint and read back by the consumer. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EnqueuedMessage(String source, String eventName) {}
