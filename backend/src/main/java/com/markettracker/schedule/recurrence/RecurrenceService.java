package com.markettracker.schedule.recurrence;

import com.markettracker.domain.JobSchedule;
import com.markettracker.domain.ScheduleFrequency;
import com.markettracker.schedule.config.SchedulerProperties;
import com.markettracker.schedule.store.JobScheduleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Applies {@link RecurrenceEngine} to the store. Both operations are idempotent: when the successor key already
 * exists nothing is inserted and empty is returned.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RecurrenceService {

    private final RecurrenceEngine recurrenceEngine;
    private final JobScheduleStore jobScheduleStore;
    private final SchedulerProperties schedulerProperties;

    /**
     * Inserts the next occurrence of a finished row. Returns the inserted row, if any.
     */
    public Optional<JobSchedule> scheduleSuccessor(JobSchedule row) {
        Optional<JobSchedule> candidate = recurrenceEngine.successor(row);
        if (candidate.isEmpty()) {
            log.debug("Job {} does not recur", row.key().label());
            return Optional.empty();
        }
        return insertIfAbsent(candidate.get(), row);
    }

    public MissedWindowDecision evaluateMissed(JobSchedule row, Instant now) {
        return recurrenceEngine.evaluateMissed(row, now, windowFor(row.getFrequency()));
    }

    /**
     * Marks a missed daily-window row SKIPPED and inserts the next slot after now.
     */
    public Optional<JobSchedule> skipAndRollForward(JobSchedule row, Instant now) {
        MissedWindowDecision decision = evaluateMissed(row, now);
        if (!decision.isSkip()) {
            return Optional.empty();
        }
        jobScheduleStore.updateStatus(row.key(), JobSchedule.JobStatus.SKIPPED);
        log.info("Job {} missed its window, marked SKIPPED", row.key().label());
        return decision.successor().flatMap(next -> insertIfAbsent(next, row));
    }

    Duration windowFor(ScheduleFrequency frequency) {
        if (frequency == ScheduleFrequency.RECURRING_DAILY_AM) {
            return schedulerProperties.getAmWindow();
        }
        if (frequency == ScheduleFrequency.RECURRING_DAILY_PM) {
            return schedulerProperties.getPmWindow();
        }
        return null;
    }

    private Optional<JobSchedule> insertIfAbsent(JobSchedule next, JobSchedule previous) {
        if (jobScheduleStore.exists(next.key())) {
            log.debug("Successor {} of {} already scheduled", next.key().label(), previous.key().label());
            return Optional.empty();
        }
        JobSchedule inserted = jobScheduleStore.insert(next);
        log.info("Scheduled successor {} of {}", inserted.key().label(), previous.key().label());
        return Optional.of(inserted);
    }
}
