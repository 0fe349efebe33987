package com.markettracker.schedule.request;

import com.markettracker.domain.JobKind;
import com.markettracker.domain.JobSchedule;
import com.markettracker.domain.ScheduleFrequency;
import com.markettracker.schedule.scheduler.SchedulerService;
import com.markettracker.schedule.store.JobScheduleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * One-off backfill of two years of daily aggregates.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HistoricalBackfillService {

    static final int BACKFILL_DAYS = 730;

    private final JobScheduleStore jobScheduleStore;
    private final SchedulerService schedulerService;
    private final Clock clock;

    /**
     * Creates a once job starting now over [today - 729 days, yesterday] and arms it.
     */
    public JobSchedule fetchPreviousTwoYears(String owner) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        LocalDate today = LocalDate.ofInstant(now, clock.getZone());
        JobSchedule row = new JobSchedule();
        row.setJobType(JobKind.DAILY_AGGREGATES_FETCH.jobType());
        row.setService(JobKind.DAILY_AGGREGATES_FETCH.service());
        row.setFrequency(ScheduleFrequency.ONCE);
        row.setOwner(owner);
        row.setScheduledStartDate(now);
        row.setDataFetchStartDate(today.minusDays(BACKFILL_DAYS - 1));
        row.setDataFetchEndDate(today.minusDays(1));
        JobSchedule inserted = jobScheduleStore.insert(row);
        log.info("Historical backfill {} for {}..{}", inserted.key().label(),
                inserted.getDataFetchStartDate(), inserted.getDataFetchEndDate());
        schedulerService.arm(inserted);
        return inserted;
    }
}
