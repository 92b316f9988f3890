package com.example.alerthistory.suppression;

import com.example.alerthistory.error.SuppressionTimeoutException;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deadline and cancellation carried by every suppression query.
 * Uses the monotonic clock so wall-clock adjustments cannot stretch a deadline.
 */
public final class QueryContext {

    private final long deadlineNanos;
    private final Duration budget;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    private QueryContext(Duration budget) {
        this.budget = budget;
        this.deadlineNanos = System.nanoTime() + budget.toNanos();
    }

    public static QueryContext withTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative");
        }
        return new QueryContext(timeout);
    }

    public static QueryContext withTimeoutMillis(long millis) {
        return withTimeout(Duration.ofMillis(millis));
    }

    public Duration getBudget() {
        return budget;
    }

    public long remainingNanos() {
        return Math.max(0, deadlineNanos - System.nanoTime());
    }

    public boolean isExpired() {
        return cancelled.get() || deadlineNanos - System.nanoTime() <= 0;
    }

    public void cancel() {
        cancelled.set(true);
    }

    /**
     * Throws if the deadline passed or the caller cancelled.
     */
    public void checkDeadline(String operation) {
        if (isExpired()) {
            throw new SuppressionTimeoutException(operation, budget);
        }
    }
}
