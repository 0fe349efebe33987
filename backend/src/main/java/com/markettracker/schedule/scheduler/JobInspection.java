package com.markettracker.schedule.scheduler;

import com.markettracker.domain.JobKey;
import com.markettracker.domain.JobSchedule;

import java.util.List;
import java.util.Optional;

/**
 * Persisted row and live triggers of one job.
 */
public record JobInspection(JobKey key, Optional<JobSchedule> row, List<TriggerSnapshot> triggers, boolean inFlight) {}
