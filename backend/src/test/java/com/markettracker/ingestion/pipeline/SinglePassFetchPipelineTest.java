package com.markettracker.ingestion.pipeline;

import com.markettracker.common.RateLimiter;
import com.markettracker.common.Sleeper;
import com.markettracker.ingestion.client.FetchOutcome;
import com.markettracker.ingestion.config.PipelineProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class SinglePassFetchPipelineTest {

    private final AtomicLong nanos = new AtomicLong();
    private final List<Duration> cooldowns = new ArrayList<>();
    private final List<Integer> batchSizes = new ArrayList<>();
    private PipelineProperties properties;
    private RateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        properties.setBatchSize(100);
        properties.setMaxRateLimitRetries(3);
        properties.setRateLimitCooldown(Duration.ofSeconds(60));
        rateLimiter = new RateLimiter(6, Duration.ofMinutes(1), nanos::get, d -> nanos.addAndGet(d.toNanos()));
    }

    @Test
    @DisplayName("a snapshot is upserted in batchSize chunks")
    void persistsInChunks() {
        List<String> rows = IntStream.range(0, 250).mapToObj(i -> "T" + i).collect(Collectors.toList());

        PipelineResult result = pipeline(() -> FetchOutcome.data(rows)).run();

        assertThat(result.isCompleted()).isTrue();
        assertThat(batchSizes).containsExactly(100, 100, 50);
        assertThat(result.recordsPersisted()).isEqualTo(250);
        assertThat(result.daysWithData()).isEqualTo(1);
    }

    @Test
    @DisplayName("rate limiting cools down and retries until the limit, then aborts")
    void rateLimitedAborts() {
        AtomicInteger calls = new AtomicInteger();

        PipelineResult result = pipeline(() -> {
            calls.incrementAndGet();
            return FetchOutcome.rateLimited("429");
        }).run();

        assertThat(result.outcome()).isEqualTo(PipelineOutcome.ABORTED);
        assertThat(calls.get()).isEqualTo(3);
        assertThat(cooldowns).containsExactly(Duration.ofSeconds(60), Duration.ofSeconds(60));
        assertThat(result.daysFailed()).isEqualTo(1);
    }

    @Test
    @DisplayName("a hard error completes the pass with nothing persisted")
    void hardErrorCompletes() {
        PipelineResult result = pipeline(() -> FetchOutcome.hardError("HTTP 503")).run();

        assertThat(result.isCompleted()).isTrue();
        assertThat(result.daysFailed()).isEqualTo(1);
        assertThat(batchSizes).isEmpty();
    }

    @Test
    @DisplayName("one rate-limit hit then data completes")
    void recoversAfterOneHit() {
        AtomicInteger calls = new AtomicInteger();

        PipelineResult result = pipeline(() -> calls.incrementAndGet() == 1
                ? FetchOutcome.rateLimited("429")
                : FetchOutcome.data(List.of("AAPL"))).run();

        assertThat(result.isCompleted()).isTrue();
        assertThat(result.rateLimitHits()).isEqualTo(1);
        assertThat(result.recordsPersisted()).isEqualTo(1);
    }

    private SinglePassFetchPipeline<String> pipeline(SnapshotFetcher<String> fetcher) {
        RecordSink<String> sink = batch -> {
            batchSizes.add(batch.size());
            return batch.size();
        };
        Sleeper sleeper = cooldowns::add;
        return new SinglePassFetchPipeline<>("test", fetcher, sink, rateLimiter, properties, sleeper);
    }
}
