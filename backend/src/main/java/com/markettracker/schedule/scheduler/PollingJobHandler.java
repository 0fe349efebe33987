package com.markettracker.schedule.scheduler;

import com.markettracker.domain.JobKind;
import com.markettracker.domain.JobSchedule;

/**
 * One tick of a windowed (custom_schedule) job, invoked every polling interval while the window is open.
 */
public interface PollingJobHandler {

    boolean supports(JobKind kind);

    void poll(JobSchedule schedule);
}
