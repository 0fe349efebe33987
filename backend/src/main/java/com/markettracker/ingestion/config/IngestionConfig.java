package com.markettracker.ingestion.config;

import com.markettracker.common.RateLimiter;
import com.markettracker.common.RetryPolicy;
import com.markettracker.common.Sleeper;
import com.markettracker.ingestion.client.DailyAggregateRecord;
import com.markettracker.ingestion.client.DailyAggregatesClient;
import com.markettracker.ingestion.client.FetchOutcome;
import com.markettracker.ingestion.client.ScreenerClient;
import com.markettracker.ingestion.client.ScreenerRecord;
import com.markettracker.ingestion.client.TickerProfileRecord;
import com.markettracker.ingestion.pipeline.RateLimitedFetchPipeline;
import com.markettracker.ingestion.pipeline.SinglePassFetchPipeline;
import com.markettracker.ingestion.store.ScreenerSnapshotStore;
import com.markettracker.ingestion.store.StockPriceStore;
import com.markettracker.ingestion.store.TickerProfileStore;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Ingestion wiring: one request limiter per source (shared by all runs of that source) and one pipeline per
 * job kind.
 */
@Configuration
@EnableConfigurationProperties({ PipelineProperties.class, SourceProperties.class })
public class IngestionConfig {

    @Bean(name = "dailyAggregatesRateLimiter")
    public RateLimiter dailyAggregatesRateLimiter(PipelineProperties pipelineProperties) {
        return new RateLimiter(Math.max(1, pipelineProperties.getMaxRequestsPerMinute()));
    }

    @Bean(name = "screenerPassRateLimiter")
    public RateLimiter screenerPassRateLimiter(SourceProperties sourceProperties) {
        return new RateLimiter(Math.max(1, sourceProperties.getStockAnalysis().getRequestsPerMinute()));
    }

    /** Local budget on the scrape endpoint itself, checked by the client before each HTTP call. */
    @Bean(name = "screenerRateLimiter")
    public io.github.resilience4j.ratelimiter.RateLimiter screenerRateLimiter(SourceProperties sourceProperties) {
        SourceProperties.StockAnalysis props = sourceProperties.getStockAnalysis();
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(Math.max(1, props.getRequestsPerMinute()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, props.getLocalLimiterTimeoutMs())))
                .build();
        return io.github.resilience4j.ratelimiter.RateLimiter.of("stock-analysis", config);
    }

    @Bean(name = "screenerRetryPolicy")
    public RetryPolicy screenerRetryPolicy(SourceProperties sourceProperties) {
        SourceProperties.StockAnalysis props = sourceProperties.getStockAnalysis();
        return RetryPolicy.exponential(props.getRetryBaseDelayMs(), 0.2, Math.max(1, props.getMaxAttempts()),
                props.getRetryMaxDelayMs());
    }

    @Bean
    public RateLimitedFetchPipeline<DailyAggregateRecord> dailyAggregatesPipeline(
            DailyAggregatesClient dailyAggregatesClient,
            StockPriceStore stockPriceStore,
            @Qualifier("dailyAggregatesRateLimiter") RateLimiter rateLimiter,
            PipelineProperties pipelineProperties,
            @Qualifier("ingestion-worker-executor") Executor workerExecutor,
            Sleeper sleeper) {
        return new RateLimitedFetchPipeline<>("daily-aggregates", dailyAggregatesClient::fetch,
                stockPriceStore::upsertBatch, rateLimiter, pipelineProperties, workerExecutor, sleeper);
    }

    @Bean
    public SinglePassFetchPipeline<ScreenerRecord> screenerSnapshotPipeline(
            ScreenerClient screenerClient,
            ScreenerSnapshotStore screenerSnapshotStore,
            @Qualifier("screenerPassRateLimiter") RateLimiter rateLimiter,
            PipelineProperties pipelineProperties,
            Sleeper sleeper) {
        return new SinglePassFetchPipeline<>("screener-snapshot", () -> FetchOutcome.capture(screenerClient::fetchSnapshot),
                screenerSnapshotStore::upsertBatch, rateLimiter, pipelineProperties, sleeper);
    }

    @Bean
    public SinglePassFetchPipeline<TickerProfileRecord> tickerProfilePipeline(
            ScreenerClient screenerClient,
            TickerProfileStore tickerProfileStore,
            @Qualifier("screenerPassRateLimiter") RateLimiter rateLimiter,
            PipelineProperties pipelineProperties,
            Sleeper sleeper) {
        return new SinglePassFetchPipeline<>("ticker-profiles", () -> FetchOutcome.capture(screenerClient::fetchTickerProfiles),
                tickerProfileStore::upsertBatch, rateLimiter, pipelineProperties, sleeper);
    }
}
