package com.markettracker.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Rate-limited fetch pipeline settings. Defaults match the free tier of the daily aggregates API (5 req/min).
 */
@ConfigurationProperties(prefix = "markettracker.ingestion.pipeline")
@NoArgsConstructor
@Getter
@Setter
public class PipelineProperties {

    /**
     * Requests per rolling minute. Also the size of the per-run day worker pool.
     */
    private int maxRequestsPerMinute = 5;

    /** Pause after an HTTP 429 before the same day is retried. */
    private Duration rateLimitCooldown = Duration.ofSeconds(60);

    /** Rate-limit hits per run after which the run is aborted. */
    private int maxRateLimitRetries = 15;

    /** Records per upsert batch. */
    private int batchSize = 100;

    /** Consumer flushes its partial buffer after this long without input. */
    private Duration consumerIdleTimeout = Duration.ofSeconds(60);

    /** Capacity of the producer to consumer queue (in fetched days). */
    private int queueCapacity = 64;

    /** Pipeline runs executing at once. */
    private int concurrentRuns = 4;
}
