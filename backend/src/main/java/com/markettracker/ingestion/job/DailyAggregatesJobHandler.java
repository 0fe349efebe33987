package com.markettracker.ingestion.job;

import com.markettracker.domain.JobKind;
import com.markettracker.domain.JobSchedule;
import com.markettracker.ingestion.client.DailyAggregateRecord;
import com.markettracker.ingestion.pipeline.PipelineResult;
import com.markettracker.ingestion.pipeline.RateLimitedFetchPipeline;
import com.markettracker.schedule.scheduler.JobHandler;
import com.markettracker.schedule.scheduler.JobRunOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs the daily aggregates pipeline over the row's data fetch range. An aborted run (rate-limit circuit open)
 * or a row without a range fails the job.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DailyAggregatesJobHandler implements JobHandler {

    private final RateLimitedFetchPipeline<DailyAggregateRecord> dailyAggregatesPipeline;

    @Override
    public boolean supports(JobKind kind) {
        return kind == JobKind.DAILY_AGGREGATES_FETCH;
    }

    @Override
    public JobRunOutcome run(JobSchedule schedule) {
        if (!schedule.hasFetchRange()) {
            log.warn("Job {} has no data fetch range", schedule.key().label());
            return JobRunOutcome.FAILED;
        }
        PipelineResult result = dailyAggregatesPipeline.run(schedule.getDataFetchStartDate(), schedule.getDataFetchEndDate());
        log.info("Job {}: {} ({} day(s) requested, {} record(s), {} rate-limit hit(s))", schedule.key().label(),
                result.outcome(), result.daysRequested(), result.recordsPersisted(), result.rateLimitHits());
        return result.isCompleted() ? JobRunOutcome.COMPLETED : JobRunOutcome.FAILED;
    }
}
