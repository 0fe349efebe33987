package com.markettracker.domain;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Composite natural key of a job schedule row. Start is held at millisecond precision, as persisted.
 */
public record JobKey(String jobType, String service, ScheduleFrequency frequency, Instant scheduledStartDate) {

    public JobKey {
        Objects.requireNonNull(jobType, "jobType");
        Objects.requireNonNull(service, "service");
        Objects.requireNonNull(frequency, "frequency");
        Objects.requireNonNull(scheduledStartDate, "scheduledStartDate");
        scheduledStartDate = scheduledStartDate.truncatedTo(ChronoUnit.MILLIS);
    }

    /** Display label for logs and trigger ids, e.g. {@code job-api_fetch-polygon_io-once-1700000000}. */
    public String label() {
        return "job-" + jobType + "-" + service + "-" + frequency.wireValue() + "-" + scheduledStartDate.getEpochSecond();
    }

    @Override
    public String toString() {
        return label();
    }
}
