package com.markettracker.ingestion.job;

import com.markettracker.domain.JobKind;
import com.markettracker.domain.JobSchedule;
import com.markettracker.ingestion.client.TickerProfileRecord;
import com.markettracker.ingestion.pipeline.PipelineResult;
import com.markettracker.ingestion.pipeline.SinglePassFetchPipeline;
import com.markettracker.schedule.scheduler.JobHandler;
import com.markettracker.schedule.scheduler.JobRunOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class TickerProfileJobHandler implements JobHandler {

    private final SinglePassFetchPipeline<TickerProfileRecord> tickerProfilePipeline;

    @Override
    public boolean supports(JobKind kind) {
        return kind == JobKind.TICKER_PROFILE_SCRAPE;
    }

    @Override
    public JobRunOutcome run(JobSchedule schedule) {
        PipelineResult result = tickerProfilePipeline.run();
        return result.isCompleted() ? JobRunOutcome.COMPLETED : JobRunOutcome.FAILED;
    }
}
