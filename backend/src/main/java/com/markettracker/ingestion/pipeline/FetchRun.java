package com.markettracker.ingestion.pipeline;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mutable state of one pipeline run, shared by the producer and all day workers.
 * <p>
 * A request starts only while rate-limit hits plus outstanding requests stay below maxRateLimitRetries.
 */
final class FetchRun {

    private final int maxRateLimitRetries;
    private final AtomicInteger daysWithData = new AtomicInteger();
    private final AtomicInteger daysEmpty = new AtomicInteger();
    private final AtomicInteger daysFailed = new AtomicInteger();

    private int rateLimitHits;
    private int outstanding;
    private volatile boolean aborted;

    FetchRun(int maxRateLimitRetries) {
        this.maxRateLimitRetries = Math.max(1, maxRateLimitRetries);
    }

    /**
     * Reserves one request. Waits while the remaining budget is held by outstanding requests.
     * Returns false once the run is aborted.
     */
    synchronized boolean beginRequest() throws InterruptedException {
        while (!aborted && rateLimitHits + outstanding >= maxRateLimitRetries) {
            wait();
        }
        if (aborted) {
            return false;
        }
        outstanding++;
        return true;
    }

    /**
     * Releases a reservation taken by {@link #beginRequest()}. Returns true when this request's rate-limit hit
     * trips the breaker.
     */
    synchronized boolean endRequest(boolean rateLimited) {
        outstanding--;
        boolean tripped = rateLimited && recordRateLimitHit();
        notifyAll();
        return tripped;
    }

    /**
     * Counts a rate-limit hit, never past maxRateLimitRetries. Returns true only for the hit that trips the breaker.
     */
    synchronized boolean recordRateLimitHit() {
        if (rateLimitHits >= maxRateLimitRetries) {
            return false;
        }
        rateLimitHits++;
        if (rateLimitHits == maxRateLimitRetries) {
            aborted = true;
            notifyAll();
            return true;
        }
        return false;
    }

    synchronized void abort() {
        aborted = true;
        notifyAll();
    }

    boolean isAborted() {
        return aborted;
    }

    void dayWithData() {
        daysWithData.incrementAndGet();
    }

    void dayEmpty() {
        daysEmpty.incrementAndGet();
    }

    void dayFailed() {
        daysFailed.incrementAndGet();
    }

    synchronized int rateLimitHits() {
        return rateLimitHits;
    }

    int daysWithData() {
        return daysWithData.get();
    }

    int daysEmpty() {
        return daysEmpty.get();
    }

    int daysFailed() {
        return daysFailed.get();
    }

    int maxRateLimitRetries() {
        return maxRateLimitRetries;
    }
}
