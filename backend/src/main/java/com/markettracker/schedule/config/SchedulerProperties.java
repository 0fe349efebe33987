package com.markettracker.schedule.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Trigger timing for the job scheduler: missed-job restart, misfire tolerance, polling cadence and the
 * eligibility windows of the AM/PM daily slots.
 */
@ConfigurationProperties(prefix = "markettracker.scheduler")
@NoArgsConstructor
@Getter
@Setter
public class SchedulerProperties {

    /** Delay before a missed SCHEDULED/RUNNING job is re-run after startup. */
    private Duration restartDelay = Duration.ofSeconds(30);

    /** A trigger firing later than this is logged as misfired (still dispatched). */
    private Duration misfireGraceTime = Duration.ofSeconds(120);

    /** Size of the job-handler pool. */
    private int handlerPoolSize = 20;

    /** Size of the trigger timer pool. */
    private int timerPoolSize = 2;

    /** Interval between screener passes while a custom_schedule window is open. */
    private Duration pollingInterval = Duration.ofMinutes(5);

    /** How long after its slot a missed recurring_daily_am row may still run. */
    private Duration amWindow = Duration.ofHours(10);

    /** How long after its slot a missed recurring_daily_pm row may still run. */
    private Duration pmWindow = Duration.ofHours(10);

    private AutoTickerJobs autoTickerJobs = new AutoTickerJobs();

    /**
     * Ticker-profile jobs the service keeps seeded for itself (owner AutoGen).
     */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class AutoTickerJobs {

        private boolean enabled = true;

        /** UTC hour of the recurring_daily_am slot. */
        private int amHour = 11;

        /** UTC hour of the recurring_daily_pm slot. */
        private int pmHour = 23;

        private String owner = "AutoGen";
    }
}
