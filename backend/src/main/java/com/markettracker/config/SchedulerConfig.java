package com.markettracker.config;

import com.markettracker.common.Sleeper;
import com.markettracker.schedule.config.SchedulerProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Timer pool for job triggers, plus the clock and sleeper every time-dependent component shares.
 */
@Configuration
public class SchedulerConfig {

    public static final String TRIGGER_TIMER = "trigger-timer";

    @Bean(name = TRIGGER_TIMER)
    public ThreadPoolTaskScheduler triggerTimer(SchedulerProperties schedulerProperties) {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(Math.max(1, schedulerProperties.getTimerPoolSize()));
        s.setThreadNamePrefix("trigger-timer-");
        s.setRemoveOnCancelPolicy(true);
        s.setWaitForTasksToCompleteOnShutdown(false);
        s.initialize();
        return s;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.system();
    }
}
