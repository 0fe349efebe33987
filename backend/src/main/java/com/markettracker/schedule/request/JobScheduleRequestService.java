package com.markettracker.schedule.request;

import com.markettracker.domain.JobKind;
import com.markettracker.domain.JobSchedule;
import com.markettracker.domain.ScheduleFrequency;
import com.markettracker.schedule.scheduler.SchedulerService;
import com.markettracker.schedule.store.JobScheduleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Validates a schedule request, inserts its row and reconciles the scheduler so the row is armed.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JobScheduleRequestService {

    private final JobScheduleStore jobScheduleStore;
    private final SchedulerService schedulerService;

    public JobSchedule submit(JobScheduleRequest request) {
        JobSchedule row = toSchedule(request);
        JobSchedule inserted = jobScheduleStore.insert(row);
        log.info("Schedule request accepted: {} (owner {})", inserted.key().label(), inserted.getOwner());
        schedulerService.reconcile();
        return inserted;
    }

    JobSchedule toSchedule(JobScheduleRequest request) {
        JobKind kind = JobKind.of(request.jobType(), request.service())
                .orElseThrow(() -> new ScheduleRequestException(ScheduleRequestException.UNKNOWN_JOB_KIND,
                        "Unknown job kind: " + request.jobType() + "/" + request.service()));
        ScheduleFrequency frequency = ScheduleFrequency.fromWire(request.frequency())
                .orElseThrow(() -> new ScheduleRequestException(ScheduleRequestException.UNKNOWN_FREQUENCY,
                        "Unknown frequency: " + request.frequency()));

        JobSchedule row = new JobSchedule();
        row.setJobType(kind.jobType());
        row.setService(kind.service());
        row.setFrequency(frequency);
        row.setOwner(request.owner());

        if (isBlank(request.scheduledStart())) {
            throw new ScheduleRequestException(ScheduleRequestException.INVALID_WINDOW, "scheduledStart is required");
        }
        Instant start = parseInstant(request.scheduledStart());
        Instant end = isBlank(request.scheduledEnd()) ? null : parseInstant(request.scheduledEnd());
        if (end != null && !end.isAfter(start)) {
            throw new ScheduleRequestException(ScheduleRequestException.INVALID_WINDOW,
                    "scheduledEnd must be after scheduledStart");
        }
        row.setScheduledStartDate(start);
        row.setScheduledEndDate(end);

        if (request.intervalDays() != null) {
            if (request.intervalDays() <= 0) {
                throw new ScheduleRequestException(ScheduleRequestException.INVALID_INTERVAL,
                        "intervalDays must be positive, got " + request.intervalDays());
            }
            row.setIntervalDays(request.intervalDays());
        }
        if (!isBlank(request.weekdays())) {
            row.setWeekdays(WeekdayCodec.parse(request.weekdays()));
        }
        if (end == null && (frequency == ScheduleFrequency.CUSTOM_SCHEDULE || row.hasWeekdays() || row.hasInterval())) {
            throw new ScheduleRequestException(ScheduleRequestException.INVALID_WINDOW,
                    "scheduledEnd is required for " + frequency.wireValue() + " and weekday/interval recurrences");
        }

        boolean hasFetchStart = !isBlank(request.dataFetchStart());
        boolean hasFetchEnd = !isBlank(request.dataFetchEnd());
        if (hasFetchStart != hasFetchEnd) {
            throw new ScheduleRequestException(ScheduleRequestException.INVALID_FETCH_RANGE,
                    "dataFetchStart and dataFetchEnd must be given together");
        }
        if (hasFetchStart) {
            LocalDate fetchStart = parseDate(request.dataFetchStart());
            LocalDate fetchEnd = parseDate(request.dataFetchEnd());
            if (fetchStart.isAfter(fetchEnd)) {
                throw new ScheduleRequestException(ScheduleRequestException.INVALID_FETCH_RANGE,
                        "dataFetchStart is after dataFetchEnd");
            }
            row.setDataFetchStartDate(fetchStart);
            row.setDataFetchEndDate(fetchEnd);
        } else if (kind == JobKind.DAILY_AGGREGATES_FETCH) {
            throw new ScheduleRequestException(ScheduleRequestException.INVALID_FETCH_RANGE,
                    "A data fetch range is required for " + kind.service());
        }
        return row;
    }

    private static Instant parseInstant(String value) {
        String v = value.strip();
        try {
            return Instant.parse(v);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(v).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e2) {
                throw new ScheduleRequestException(ScheduleRequestException.INVALID_WINDOW, "Invalid timestamp: " + value, e2);
            }
        }
    }

    private static LocalDate parseDate(String value) {
        try {
            return LocalDate.parse(value.strip());
        } catch (DateTimeParseException e) {
            throw new ScheduleRequestException(ScheduleRequestException.INVALID_FETCH_RANGE, "Invalid date: " + value, e);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
