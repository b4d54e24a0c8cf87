package com.tracebridge.transport.rabbitmq;

public enum ConsumerState {
    DISCONNECTED,
    CONNECTING,
    CONSUMING,
    STOPPED
}
