package com.markettracker.common;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Spacing rate limiter: grants at most {@code permits} per {@code period} in any rolling window.
 * Grants are spaced at least {@code period / permits} apart, so N+1 grants always span a full period.
 * Used by the fetch pipeline to respect external requests-per-minute ceilings.
 */
public class RateLimiter {

    private final long minIntervalNanos;
    private final LongSupplier nanoTime;
    private final Sleeper sleeper;
    private final AtomicLong nextFreeAtNanos;

    /**
     * @param permitsPerMinute e.g. 5 for 5 requests per minute
     */
    public RateLimiter(int permitsPerMinute) {
        this(permitsPerMinute, Duration.ofMinutes(1), System::nanoTime, Sleeper.system());
    }

    public RateLimiter(int permits, Duration period, LongSupplier nanoTime, Sleeper sleeper) {
        if (permits <= 0) {
            throw new IllegalArgumentException("permits must be positive");
        }
        if (period == null || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive");
        }
        this.minIntervalNanos = period.toNanos() / permits;
        this.nanoTime = nanoTime;
        this.sleeper = sleeper;
        this.nextFreeAtNanos = new AtomicLong(nanoTime.getAsLong());
    }

    /**
     * Blocks until a permit is available, then returns.
     *
     * @return time spent waiting
     */
    public Duration acquire() {
        long start = nanoTime.getAsLong();
        long now;
        long next;
        do {
            now = nanoTime.getAsLong();
            next = nextFreeAtNanos.get();
            if (now >= next) {
                if (nextFreeAtNanos.compareAndSet(next, now + minIntervalNanos)) {
                    return Duration.ofNanos(now - start);
                }
            } else {
                try {
                    sleeper.sleep(Duration.ofNanos(next - now));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Rate limiter interrupted", e);
                }
            }
        } while (true);
    }
}
