package com.markettracker.ingestion.job;

import com.markettracker.domain.JobKind;
import com.markettracker.domain.JobSchedule;
import com.markettracker.ingestion.client.ScreenerRecord;
import com.markettracker.ingestion.pipeline.PipelineResult;
import com.markettracker.ingestion.pipeline.SinglePassFetchPipeline;
import com.markettracker.schedule.scheduler.JobHandler;
import com.markettracker.schedule.scheduler.JobRunOutcome;
import com.markettracker.schedule.scheduler.PollingJobHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Screener snapshot: a single pass for one-shot rows, one pass per tick while a custom_schedule window is open.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ScreenerScrapeJobHandler implements JobHandler, PollingJobHandler {

    private final SinglePassFetchPipeline<ScreenerRecord> screenerSnapshotPipeline;

    @Override
    public boolean supports(JobKind kind) {
        return kind == JobKind.SCREENER_SCRAPE;
    }

    @Override
    public JobRunOutcome run(JobSchedule schedule) {
        PipelineResult result = screenerSnapshotPipeline.run();
        return result.isCompleted() ? JobRunOutcome.COMPLETED : JobRunOutcome.FAILED;
    }

    @Override
    public void poll(JobSchedule schedule) {
        PipelineResult result = screenerSnapshotPipeline.run();
        log.debug("Poll {}: {} record(s)", schedule.key().label(), result.recordsPersisted());
    }
}
