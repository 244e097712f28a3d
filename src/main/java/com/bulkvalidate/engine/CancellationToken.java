package com.bulkvalidate.engine;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for one batch. Checked by the dispatcher, the workers and the
 * collector; it never interrupts a job that is already running.
 */
public class CancellationToken {
    // nanoTime differences are only meaningful below 2^63; longer timeouts never fire
    private static final long MAX_TIMEOUT_NANOS = Long.MAX_VALUE / 2;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final boolean timed;
    private final long deadlineNanos;

    private CancellationToken(boolean timed, long deadlineNanos) {
        this.timed = timed;
        this.deadlineNanos = deadlineNanos;
    }

    public static CancellationToken create() {
        return new CancellationToken(false, 0L);
    }

    public static CancellationToken none() {
        return create();
    }

    public static CancellationToken withTimeout(Duration timeout) {
        if (timeout.isNegative()) throw new IllegalArgumentException("timeout must not be negative");
        if (timeout.compareTo(Duration.ofNanos(MAX_TIMEOUT_NANOS)) > 0) {
            return create();
        }
        return new CancellationToken(true, System.nanoTime() + timeout.toNanos());
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        if (cancelled.get()) return true;
        if (timed && System.nanoTime() - deadlineNanos >= 0) {
            cancelled.set(true);
            return true;
        }
        return false;
    }
}
