package com.tracebridge.transport.rabbitmq;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/** One-shot cancellation shared by a reconnect loop and its backoff waits. */
public final class CancellationSignal {
    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Waits for cancellation at most {@code timeout}. An interrupt counts as cancellation; the interrupt flag
     * is restored.
     *
     * @return true if cancelled
     */
    public boolean await(Duration timeout) {
        try {
            return cancelled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
