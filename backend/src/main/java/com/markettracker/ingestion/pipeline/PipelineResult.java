package com.markettracker.ingestion.pipeline;

import java.time.Duration;

/**
 * Summary of one pipeline run. For single-pass runs the "days" counters count the one request.
 */
public record PipelineResult(
        PipelineOutcome outcome,
        int daysRequested,
        int daysWithData,
        int daysEmpty,
        int daysFailed,
        int recordsPersisted,
        int recordsFailed,
        int rateLimitHits,
        Duration elapsed
) {

    public boolean isCompleted() {
        return outcome == PipelineOutcome.COMPLETED;
    }
}
