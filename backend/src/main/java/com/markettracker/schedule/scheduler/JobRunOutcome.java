package com.markettracker.schedule.scheduler;

public enum JobRunOutcome {
    COMPLETED,
    /** Run gave up (e.g. rate-limit circuit open). The row is marked FAILED and does not recur. */
    FAILED
}
