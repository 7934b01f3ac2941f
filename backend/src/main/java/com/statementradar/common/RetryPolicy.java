package com.statementradar.common;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with additive uniform jitter, capped at a maximum delay.
 * Formula: min(baseDelay * 2^attempt + uniform(0, jitter), maxDelay).
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final long jitterMs;
    private final long maxDelayMs;
    private final int maxAttempts;
    private final DoubleSupplier random;

    public RetryPolicy(long baseDelayMs, long jitterMs, long maxDelayMs, int maxAttempts) {
        this(baseDelayMs, jitterMs, maxDelayMs, maxAttempts, () -> ThreadLocalRandom.current().nextDouble());
    }

    RetryPolicy(long baseDelayMs, long jitterMs, long maxDelayMs, int maxAttempts, DoubleSupplier random) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.jitterMs = Math.max(0, jitterMs);
        this.maxDelayMs = Math.max(0, maxDelayMs);
        this.maxAttempts = maxAttempts;
        this.random = random;
    }

    /**
     * Delay in milliseconds before retrying after the given zero-based failed attempt.
     */
    public long delayMs(int attempt) {
        long exponential = baseDelayMs * (1L << Math.min(Math.max(attempt, 0), 20));
        long jitter = (long) (random.getAsDouble() * jitterMs);
        return Math.min(exponential + jitter, maxDelayMs);
    }

    /** Total calls allowed, the first one included. */
    public int getMaxAttempts() {
        return maxAttempts;
    }

    public boolean hasAttemptsLeft(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    /**
     * Default: 1s base, up to 1s jitter, 60s cap, 3 attempts.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(1000L, 1000L, 60_000L, 3);
    }
}
