package com.markettracker.ingestion.pipeline;

public enum PipelineOutcome {
    COMPLETED,
    /** Circuit breaker tripped (too many rate-limit hits) or the run was interrupted. */
    ABORTED
}
