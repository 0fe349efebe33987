package com.markettracker.ingestion.pipeline;

import com.markettracker.common.RateLimiter;
import com.markettracker.common.Sleeper;
import com.markettracker.ingestion.client.FetchOutcome;
import com.markettracker.ingestion.config.PipelineProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.LocalDate;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Fetches a date range one calendar day per request without exceeding the source's requests-per-minute ceiling.
 * <p>
 * A producer walks the range and, for each day, takes a rate-limiter permit and hands the day to a worker pool of
 * size maxRequestsPerMinute. Workers forward records to a {@link BatchingConsumer}. HTTP 429 costs a cooldown and
 * one hit on the run's shared counter; when the counter reaches maxRateLimitRetries the run is ABORTED: no further
 * days are submitted and no worker retries. Requests are reserved against the remaining hit budget, so an always-429
 * source sees exactly maxRateLimitRetries requests whatever the worker count.
 * <p>
 * Completion: join the producer, enqueue end-of-stream, join the consumer. An aborted run asks the consumer to
 * finish and returns without waiting for it.
 */
@Slf4j
public class RateLimitedFetchPipeline<T> {

    private final String name;
    private final DayFetcher<T> fetcher;
    private final RecordSink<T> sink;
    private final RateLimiter rateLimiter;
    private final PipelineProperties properties;
    private final Executor workerExecutor;
    private final Sleeper sleeper;

    public RateLimitedFetchPipeline(String name, DayFetcher<T> fetcher, RecordSink<T> sink, RateLimiter rateLimiter,
                                    PipelineProperties properties, Executor workerExecutor, Sleeper sleeper) {
        this.name = name;
        this.fetcher = fetcher;
        this.sink = sink;
        this.rateLimiter = rateLimiter;
        this.properties = properties;
        this.workerExecutor = workerExecutor;
        this.sleeper = sleeper;
    }

    /**
     * Fetches every calendar day in [from, to] (inclusive). Blocks until done; run it off timer threads.
     */
    public PipelineResult run(LocalDate from, LocalDate to) {
        long startNanos = System.nanoTime();
        int days = from.isAfter(to) ? 0 : (int) (to.toEpochDay() - from.toEpochDay() + 1);
        FetchRun run = new FetchRun(properties.getMaxRateLimitRetries());
        BatchingConsumer<T> consumer = new BatchingConsumer<>(sink, properties.getBatchSize(),
                properties.getConsumerIdleTimeout(), properties.getQueueCapacity(), name + "-consumer");
        log.info("{}: fetching {} day(s) {}..{}", name, days, from, to);

        CompletableFuture<Void> consumerTask = CompletableFuture.runAsync(consumer, workerExecutor);
        CompletableFuture<Void> producerTask = CompletableFuture.runAsync(() -> produce(from, days, run, consumer), workerExecutor);
        try {
            producerTask.join();
        } catch (CompletionException e) {
            log.error("{}: producer failed", name, e.getCause());
            run.abort();
        }
        if (run.isAborted()) {
            consumer.requestFinish();
            PipelineResult result = result(PipelineOutcome.ABORTED, days, run, consumer, startNanos);
            log.error("{}: run ABORTED after {} rate-limit hit(s) ({} day(s) with data, {} record(s) persisted so far)",
                    name, result.rateLimitHits(), result.daysWithData(), result.recordsPersisted());
            return result;
        }
        try {
            consumer.finish();
            consumerTask.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            consumer.requestFinish();
            return result(PipelineOutcome.ABORTED, days, run, consumer, startNanos);
        } catch (CompletionException e) {
            log.error("{}: consumer failed", name, e.getCause());
        }
        PipelineResult result = result(PipelineOutcome.COMPLETED, days, run, consumer, startNanos);
        log.info("{}: completed {} day(s) ({} with data, {} empty, {} failed), {} record(s) persisted in {}",
                name, days, result.daysWithData(), result.daysEmpty(), result.daysFailed(),
                result.recordsPersisted(), result.elapsed());
        return result;
    }

    private void produce(LocalDate from, int days, FetchRun run, BatchingConsumer<T> consumer) {
        int workers = Math.max(1, properties.getMaxRequestsPerMinute());
        Semaphore freeWorkers = new Semaphore(workers);
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            for (int i = 0; i < days; i++) {
                LocalDate day = from.plusDays(i);
                freeWorkers.acquire();
                if (run.isAborted()) {
                    freeWorkers.release();
                    log.warn("{}: circuit open, {} day(s) not submitted from {}", name, days - i, day);
                    break;
                }
                if (!acquirePermit(run)) {
                    freeWorkers.release();
                    break;
                }
                pool.execute(() -> {
                    try {
                        fetchDay(day, run, consumer);
                    } finally {
                        freeWorkers.release();
                    }
                });
            }
            pool.shutdown();
            while (!pool.awaitTermination(1, TimeUnit.MINUTES)) {
                log.debug("{}: waiting for in-flight days", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{}: producer interrupted, aborting run", name);
            run.abort();
            pool.shutdownNow();
        }
    }

    /**
     * One day: the first attempt uses the permit taken by the producer; each retry after a 429 takes a new one.
     */
    private void fetchDay(LocalDate day, FetchRun run, BatchingConsumer<T> consumer) {
        boolean permitHeld = true;
        while (true) {
            if (run.isAborted()) {
                run.dayFailed();
                return;
            }
            if (!permitHeld && !acquirePermit(run)) {
                run.dayFailed();
                return;
            }
            permitHeld = false;
            if (!beginRequest(run)) {
                run.dayFailed();
                return;
            }
            FetchOutcome<T> outcome;
            try {
                outcome = fetchQuietly(day);
            } catch (Error e) {
                run.endRequest(false);
                throw e;
            }
            boolean tripped = run.endRequest(outcome.kind() == FetchOutcome.Kind.RATE_LIMITED);
            switch (outcome.kind()) {
                case DATA -> {
                    try {
                        consumer.accept(outcome.records());
                        run.dayWithData();
                        log.debug("{}: {} record(s) for {}", name, outcome.records().size(), day);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        run.abort();
                        run.dayFailed();
                    }
                    return;
                }
                case EMPTY -> {
                    run.dayEmpty();
                    log.info("{}: no data for {} (market closed)", name, day);
                    return;
                }
                case HARD_ERROR -> {
                    run.dayFailed();
                    log.warn("{}: skipping {}: {}", name, day, outcome.message());
                    return;
                }
                case RATE_LIMITED -> {
                    if (tripped) {
                        run.dayFailed();
                        log.error("{}: rate limited on {}, {} hit(s) reached, opening circuit",
                                name, day, run.maxRateLimitRetries());
                        return;
                    }
                    if (run.isAborted()) {
                        run.dayFailed();
                        return;
                    }
                    Duration cooldown = properties.getRateLimitCooldown();
                    log.warn("{}: rate limited on {} (hit {}/{}), cooling down {}",
                            name, day, run.rateLimitHits(), run.maxRateLimitRetries(), cooldown);
                    try {
                        sleeper.sleep(cooldown);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        run.abort();
                        run.dayFailed();
                        return;
                    }
                }
            }
        }
    }

    private boolean beginRequest(FetchRun run) {
        try {
            return run.beginRequest();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.abort();
            return false;
        }
    }

    private FetchOutcome<T> fetchQuietly(LocalDate day) {
        try {
            return fetcher.fetch(day);
        } catch (RuntimeException e) {
            log.warn("{}: fetch for {} threw", name, day, e);
            return FetchOutcome.hardError(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private boolean acquirePermit(FetchRun run) {
        try {
            Duration waited = rateLimiter.acquire();
            if (waited.toSeconds() >= 1) {
                log.debug("{}: waited {} for a request permit", name, waited);
            }
            return true;
        } catch (IllegalStateException e) {
            log.warn("{}: interrupted waiting for a request permit, aborting run", name);
            run.abort();
            return false;
        }
    }

    private static PipelineResult result(PipelineOutcome outcome, int days, FetchRun run,
                                         BatchingConsumer<?> consumer, long startNanos) {
        return new PipelineResult(outcome, days, run.daysWithData(), run.daysEmpty(), run.daysFailed(),
                consumer.persisted(), consumer.failed(), run.rateLimitHits(),
                Duration.ofNanos(System.nanoTime() - startNanos));
    }
}
