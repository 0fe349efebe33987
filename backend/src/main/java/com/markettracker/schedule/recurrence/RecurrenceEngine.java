package com.markettracker.schedule.recurrence;

import com.markettracker.domain.JobSchedule;
import com.markettracker.domain.ScheduleFrequency;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Computes the next occurrence of a job schedule row. Pure: no store access, no clock.
 * <p>
 * Rule precedence: weekday set, then fixed interval, then the frequency's daily rule. Times of day are
 * evaluated in UTC.
 */
@Component
public class RecurrenceEngine {

    /**
     * Successor row (status SCHEDULED, no run time), or empty when the row does not recur.
     */
    public Optional<JobSchedule> successor(JobSchedule row) {
        ScheduleFrequency frequency = row.getFrequency();
        if (frequency == null || frequency == ScheduleFrequency.ONCE || row.getScheduledStartDate() == null) {
            return Optional.empty();
        }
        if (row.hasWeekdays()) {
            return Optional.of(shifted(row, daysToNextWeekday(row), false));
        }
        if (row.hasInterval()) {
            return Optional.of(shifted(row, row.getIntervalDays(), false));
        }
        if (frequency.isDaily()) {
            return Optional.of(shifted(row, 1, true));
        }
        return Optional.empty();
    }

    /**
     * Missed-window policy for AM/PM rows. Within {@code window} after the scheduled start the row is restarted;
     * past it the row is skipped and its successor is the next slot at the same time of day strictly after now.
     * Other frequencies always restart.
     */
    public MissedWindowDecision evaluateMissed(JobSchedule row, Instant now, Duration window) {
        if (row.getFrequency() == null || !row.getFrequency().isDailyWindow() || window == null) {
            return MissedWindowDecision.restart();
        }
        Instant start = row.getScheduledStartDate();
        if (!now.isAfter(start.plus(window))) {
            return MissedWindowDecision.restart();
        }
        ZonedDateTime slot = start.atZone(ZoneOffset.UTC);
        ZonedDateTime candidate = now.atZone(ZoneOffset.UTC)
                .with(slot.toLocalTime());
        if (!candidate.toInstant().isAfter(now)) {
            candidate = candidate.plusDays(1);
        }
        long days = ChronoUnit.DAYS.between(slot.toLocalDate(), candidate.toLocalDate());
        return MissedWindowDecision.skip(shifted(row, days, true));
    }

    /** Days from the row's start to the next date (1..7 ahead) whose weekday is in the set. */
    static int daysToNextWeekday(JobSchedule row) {
        DayOfWeek current = row.getScheduledStartDate().atZone(ZoneOffset.UTC).getDayOfWeek();
        for (int offset = 1; offset <= 7; offset++) {
            if (row.getWeekdays().contains(current.plus(offset))) {
                return offset;
            }
        }
        return 7;
    }

    private static JobSchedule shifted(JobSchedule row, long days, boolean shiftFetchRange) {
        JobSchedule next = row.copyDefinition();
        next.setScheduledStartDate(row.getScheduledStartDate().plus(days, ChronoUnit.DAYS));
        if (row.getScheduledEndDate() != null) {
            next.setScheduledEndDate(row.getScheduledEndDate().plus(days, ChronoUnit.DAYS));
        }
        if (shiftFetchRange) {
            next.setDataFetchStartDate(plusDays(row.getDataFetchStartDate(), days));
            next.setDataFetchEndDate(plusDays(row.getDataFetchEndDate(), days));
        }
        next.setStatus(JobSchedule.JobStatus.SCHEDULED);
        next.setRunTime(null);
        return next;
    }

    private static LocalDate plusDays(LocalDate date, long days) {
        return date == null ? null : date.plusDays(days);
    }
}
