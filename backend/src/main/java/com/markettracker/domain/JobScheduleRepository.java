package com.markettracker.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.Optional;

/**
 * Persistence for job_schedules. Callers go through JobScheduleStore, which adds retry and key semantics.
 */
public interface JobScheduleRepository extends MongoRepository<JobSchedule, String> {

    Optional<JobSchedule> findByJobTypeAndServiceAndFrequencyAndScheduledStartDate(
            String jobType, String service, ScheduleFrequency frequency, Instant scheduledStartDate);

    long deleteByJobTypeAndServiceAndFrequencyAndScheduledStartDate(
            String jobType, String service, ScheduleFrequency frequency, Instant scheduledStartDate);
}
