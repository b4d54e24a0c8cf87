package com.tracebridge.collection.core.source;

import java.util.concurrent.atomic.AtomicBoolean;

/** Handle returned by every subscribe call. Closing is idempotent. */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();

    static Subscription of(Runnable disposer) {
        AtomicBoolean closed = new AtomicBoolean();
        return () -> {
            if (closed.compareAndSet(false, true)) disposer.run();
        };
    }
}
