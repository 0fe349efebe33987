package com.markettracker.schedule.scheduler;

import com.markettracker.domain.JobKind;
import com.markettracker.domain.JobSchedule;

/**
 * Executes one occurrence of a job kind. Called on the pipeline pool; may block. Status transitions, run time
 * and successors are handled by {@link SchedulerService}.
 */
public interface JobHandler {

    boolean supports(JobKind kind);

    JobRunOutcome run(JobSchedule schedule);
}
