package com.markettracker.schedule.request;

import com.markettracker.domain.JobKind;
import com.markettracker.domain.JobSchedule;
import com.markettracker.domain.ScheduleFrequency;
import com.markettracker.schedule.config.SchedulerProperties;
import com.markettracker.schedule.store.JobScheduleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Keeps one pending AM and one pending PM ticker-profile job per day. Runs before the scheduler's own startup
 * reconciliation so the seeded rows are armed with everything else.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AutoGeneratedJobSeeder {

    private final JobScheduleStore jobScheduleStore;
    private final SchedulerProperties schedulerProperties;
    private final Clock clock;

    @EventListener(ApplicationReadyEvent.class)
    @Order(0)
    public void onApplicationReady() {
        try {
            seedTickerProfileJobs();
        } catch (RuntimeException e) {
            log.error("Could not seed auto-generated ticker profile jobs", e);
        }
    }

    /**
     * Inserts the AM/PM rows that are missing. Returns the number inserted.
     */
    public int seedTickerProfileJobs() {
        SchedulerProperties.AutoTickerJobs config = schedulerProperties.getAutoTickerJobs();
        if (!config.isEnabled()) {
            log.debug("Auto-generated ticker profile jobs disabled");
            return 0;
        }
        List<JobSchedule> rows = jobScheduleStore.selectAll();
        Instant now = clock.instant();
        int inserted = 0;
        inserted += seed(rows, ScheduleFrequency.RECURRING_DAILY_AM, LocalTime.of(config.getAmHour(), 0), config.getOwner(), now);
        inserted += seed(rows, ScheduleFrequency.RECURRING_DAILY_PM, LocalTime.of(config.getPmHour(), 0), config.getOwner(), now);
        return inserted;
    }

    private int seed(List<JobSchedule> rows, ScheduleFrequency frequency, LocalTime slot, String owner, Instant now) {
        JobKind kind = JobKind.TICKER_PROFILE_SCRAPE;
        boolean pending = rows.stream().anyMatch(r -> kind.jobType().equals(r.getJobType())
                && kind.service().equals(r.getService())
                && r.getFrequency() == frequency
                && (r.getStatus() == JobSchedule.JobStatus.SCHEDULED || r.getStatus() == JobSchedule.JobStatus.RUNNING));
        if (pending) {
            return 0;
        }
        JobSchedule row = new JobSchedule();
        row.setJobType(kind.jobType());
        row.setService(kind.service());
        row.setFrequency(frequency);
        row.setOwner(owner);
        row.setScheduledStartDate(nextSlot(now, slot));
        JobSchedule saved = jobScheduleStore.insert(row);
        log.info("Seeded auto-generated ticker profile job {}", saved.key().label());
        return 1;
    }

    static Instant nextSlot(Instant now, LocalTime slot) {
        ZonedDateTime candidate = now.atZone(ZoneOffset.UTC).with(slot);
        if (!candidate.toInstant().isAfter(now)) {
            candidate = candidate.plusDays(1);
        }
        return candidate.toInstant();
    }
}
