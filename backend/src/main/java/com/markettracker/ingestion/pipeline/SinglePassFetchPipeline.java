package com.markettracker.ingestion.pipeline;

import com.markettracker.common.RateLimiter;
import com.markettracker.common.Sleeper;
import com.markettracker.ingestion.client.FetchOutcome;
import com.markettracker.ingestion.config.PipelineProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;

/**
 * One rate-limited request for a whole snapshot, upserted in batchSize chunks. Rate limiting follows the
 * day pipeline: cooldown and retry until maxRateLimitRetries, then ABORTED.
 */
@Slf4j
public class SinglePassFetchPipeline<T> {

    private final String name;
    private final SnapshotFetcher<T> fetcher;
    private final RecordSink<T> sink;
    private final RateLimiter rateLimiter;
    private final PipelineProperties properties;
    private final Sleeper sleeper;

    public SinglePassFetchPipeline(String name, SnapshotFetcher<T> fetcher, RecordSink<T> sink, RateLimiter rateLimiter,
                                   PipelineProperties properties, Sleeper sleeper) {
        this.name = name;
        this.fetcher = fetcher;
        this.sink = sink;
        this.rateLimiter = rateLimiter;
        this.properties = properties;
        this.sleeper = sleeper;
    }

    public PipelineResult run() {
        long startNanos = System.nanoTime();
        FetchRun run = new FetchRun(properties.getMaxRateLimitRetries());
        int persisted = 0;
        int failed = 0;
        while (!run.isAborted()) {
            try {
                rateLimiter.acquire();
            } catch (IllegalStateException e) {
                run.abort();
                break;
            }
            FetchOutcome<T> outcome = fetchQuietly();
            if (outcome.kind() == FetchOutcome.Kind.RATE_LIMITED) {
                if (run.recordRateLimitHit()) {
                    log.error("{}: rate limited {} time(s), giving up", name, run.rateLimitHits());
                    break;
                }
                log.warn("{}: rate limited (hit {}/{}), cooling down {}",
                        name, run.rateLimitHits(), run.maxRateLimitRetries(), properties.getRateLimitCooldown());
                try {
                    sleeper.sleep(properties.getRateLimitCooldown());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    run.abort();
                }
                continue;
            }
            if (outcome.kind() == FetchOutcome.Kind.EMPTY) {
                run.dayEmpty();
                log.info("{}: source returned no rows", name);
            } else if (outcome.kind() == FetchOutcome.Kind.HARD_ERROR) {
                run.dayFailed();
                log.warn("{}: pass failed: {}", name, outcome.message());
            } else {
                run.dayWithData();
                List<T> records = outcome.records();
                int batchSize = Math.max(1, properties.getBatchSize());
                for (int from = 0; from < records.size(); from += batchSize) {
                    List<T> batch = records.subList(from, Math.min(records.size(), from + batchSize));
                    try {
                        persisted += sink.persist(batch);
                    } catch (RuntimeException e) {
                        failed += batch.size();
                        log.error("{}: failed to persist batch of {} record(s)", name, batch.size(), e);
                    }
                }
            }
            break;
        }
        PipelineOutcome outcome = run.isAborted() ? PipelineOutcome.ABORTED : PipelineOutcome.COMPLETED;
        if (run.isAborted()) {
            run.dayFailed();
        }
        PipelineResult result = new PipelineResult(outcome, 1, run.daysWithData(), run.daysEmpty(), run.daysFailed(),
                persisted, failed, run.rateLimitHits(), Duration.ofNanos(System.nanoTime() - startNanos));
        log.info("{}: pass {} with {} record(s) persisted in {}", name, outcome, persisted, result.elapsed());
        return result;
    }

    private FetchOutcome<T> fetchQuietly() {
        try {
            return fetcher.fetch();
        } catch (RuntimeException e) {
            log.warn("{}: fetch threw", name, e);
            return FetchOutcome.hardError(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
