package com.markettracker.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Backoff for retries: fixed (store calls) or exponential with ±jitter (external sources), capped by maxDelayMs.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;
    private final boolean exponential;
    private final long maxDelayMs;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts, boolean exponential, long maxDelayMs) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
        this.exponential = exponential;
        this.maxDelayMs = Math.max(this.baseDelayMs, maxDelayMs);
    }

    /**
     * Same delay before every retry, no jitter.
     */
    public static RetryPolicy fixed(long delayMs, int maxAttempts) {
        return new RetryPolicy(delayMs, 0, maxAttempts, false, delayMs);
    }

    /**
     * baseDelay * 2^attempt with ±jitter, never above maxDelayMs.
     */
    public static RetryPolicy exponential(long baseDelayMs, double jitterFactor, int maxAttempts, long maxDelayMs) {
        return new RetryPolicy(baseDelayMs, jitterFactor, maxAttempts, true, maxDelayMs);
    }

    /**
     * Delay in milliseconds for the given zero-based attempt.
     */
    public long delayMs(int attempt) {
        if (!exponential || attempt <= 0) {
            return jitter(baseDelayMs);
        }
        long delay = baseDelayMs * (1L << Math.min(attempt, 20));
        return jitter(Math.min(delay, maxDelayMs));
    }

    private long jitter(long value) {
        if (jitterFactor <= 0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, Math.min(maxDelayMs, (long) (value * jitter)));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
