package com.markettracker.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Set;

/**
 * One scheduled occurrence of a data-fetch job. Persisted in job_schedules, unique on
 * (jobType, service, frequency, scheduledStartDate). Recurrence inserts a new row per occurrence;
 * a completed row is never moved forward.
 */
@Document(collection = "job_schedules")
@CompoundIndex(name = "job_schedule_key", def = "{'jobType': 1, 'service': 1, 'frequency': 1, 'scheduledStartDate': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class JobSchedule {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String jobType;
    private String service;
    private ScheduleFrequency frequency;
    private Instant scheduledStartDate;
    private JobStatus status;
    private String owner;
    /** Required for custom_schedule and weekday/interval recurrences. */
    private Instant scheduledEndDate;
    /** Date range requested from the source; distinct from when the job runs. */
    private LocalDate dataFetchStartDate;
    private LocalDate dataFetchEndDate;
    private Integer intervalDays;
    private Set<DayOfWeek> weekdays;
    /** Audit string, e.g. "0h 3m 12.50s". */
    private String runTime;
    private Instant createdAt;
    private Instant updatedAt;

    public JobKey key() {
        return new JobKey(jobType, service, frequency, scheduledStartDate);
    }

    public boolean hasWeekdays() {
        return weekdays != null && !weekdays.isEmpty();
    }

    public boolean hasInterval() {
        return intervalDays != null && intervalDays > 0;
    }

    public boolean hasFetchRange() {
        return dataFetchStartDate != null && dataFetchEndDate != null;
    }

    /** Copies everything except id, status, runTime and audit timestamps. */
    public JobSchedule copyDefinition() {
        JobSchedule copy = new JobSchedule();
        copy.setJobType(jobType);
        copy.setService(service);
        copy.setFrequency(frequency);
        copy.setScheduledStartDate(scheduledStartDate);
        copy.setOwner(owner);
        copy.setScheduledEndDate(scheduledEndDate);
        copy.setDataFetchStartDate(dataFetchStartDate);
        copy.setDataFetchEndDate(dataFetchEndDate);
        copy.setIntervalDays(intervalDays);
        copy.setWeekdays(hasWeekdays() ? EnumSet.copyOf(weekdays) : null);
        return copy;
    }

    public enum JobStatus {
        SCHEDULED,
        RUNNING,
        COMPLETE,
        FAILED,
        SKIPPED
    }
}
