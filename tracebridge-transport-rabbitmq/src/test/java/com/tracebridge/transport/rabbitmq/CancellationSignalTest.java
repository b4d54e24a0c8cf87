package com.tracebridge.transport.rabbitmq;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class CancellationSignalTest {

    @Test
    void await_times_out_while_not_cancelled() {
        CancellationSignal signal = new CancellationSignal();

        assertThat(signal.await(Duration.ofMillis(10))).isFalse();
        assertThat(signal.isCancelled()).isFalse();
    }

    @Test
    void cancel_releases_waiters_immediately() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();
        signal.cancel();

        assertThat(signal.await(Duration.ofHours(1))).isTrue();
        assertThat(signal.isCancelled()).isTrue();
    }

    @Test
    void interrupt_counts_as_cancellation() {
        CancellationSignal signal = new CancellationSignal();
        Thread.currentThread().interrupt();
        try {
            assertThat(signal.await(Duration.ofHours(1))).isTrue();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
