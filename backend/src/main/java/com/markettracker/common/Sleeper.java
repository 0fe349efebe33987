package com.markettracker.common;

import java.time.Duration;

/**
 * Blocking pause. Injected wherever the code waits (rate limiter, cooldowns, retry backoff) so tests can run on
 * virtual time.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> {
            long nanos = duration.toNanos();
            if (nanos > 0) {
                Thread.sleep(nanos / 1_000_000, (int) (nanos % 1_000_000));
            }
        };
    }
}
