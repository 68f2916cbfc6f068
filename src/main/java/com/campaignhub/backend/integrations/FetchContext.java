package com.campaignhub.backend.integrations;

import java.time.Duration;

/**
 * Shared deadline handed to every source adapter of one aggregation.
 * Immutable and safe to share between the concurrent fetches.
 */
public final class FetchContext {

    private final long deadlineNanos;
    private final Duration budget;

    private FetchContext(long deadlineNanos, Duration budget) {
        this.deadlineNanos = deadlineNanos;
        this.budget = budget;
    }

    public static FetchContext withTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Aggregation timeout must be positive: " + timeout);
        }
        return new FetchContext(System.nanoTime() + timeout.toNanos(), timeout);
    }

    /**
     * Time left before the shared deadline, never negative.
     */
    public Duration remaining() {
        long left = deadlineNanos - System.nanoTime();
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }

    public boolean isExpired() {
        return deadlineNanos - System.nanoTime() <= 0;
    }

    public Duration getBudget() {
        return budget;
    }
}
