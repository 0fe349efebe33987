package com.markettracker.schedule.store;

import com.markettracker.common.RetryPolicy;
import com.markettracker.common.Sleeper;
import com.markettracker.domain.JobKey;
import com.markettracker.domain.JobSchedule;
import com.markettracker.domain.JobScheduleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Job schedule rows keyed by {@link JobKey}. Every call is retried on transient storage failures
 * (fixed backoff); after the last attempt a {@link TransientStoreException} is thrown.
 * Inserting an existing key is a no-op that returns the stored row.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class JobScheduleStore {

    private final JobScheduleRepository repository;
    private final MongoTemplate mongoTemplate;
    @Qualifier("storeRetryPolicy")
    private final RetryPolicy storeRetryPolicy;
    private final Sleeper sleeper;
    private final Clock clock;

    /**
     * Inserts a new SCHEDULED row, or returns the existing row for the same key.
     */
    public JobSchedule insert(JobSchedule schedule) {
        JobKey key = schedule.key();
        return withRetry("insert", key, () -> {
            Optional<JobSchedule> existing = find(key);
            if (existing.isPresent()) {
                log.debug("Job {} already exists, insert skipped", key.label());
                return existing.get();
            }
            Instant now = clock.instant();
            schedule.setScheduledStartDate(key.scheduledStartDate());
            if (schedule.getScheduledEndDate() != null) {
                schedule.setScheduledEndDate(schedule.getScheduledEndDate().truncatedTo(ChronoUnit.MILLIS));
            }
            schedule.setStatus(JobSchedule.JobStatus.SCHEDULED);
            schedule.setCreatedAt(now);
            schedule.setUpdatedAt(now);
            try {
                JobSchedule saved = repository.insert(schedule);
                log.info("Inserted job {}", key.label());
                return saved;
            } catch (DuplicateKeyException e) {
                log.debug("Job {} inserted concurrently, returning stored row", key.label());
                return find(key).orElseThrow(() -> e);
            }
        });
    }

    public Optional<JobSchedule> select(JobKey key) {
        return withRetry("select", key, () -> find(key));
    }

    public List<JobSchedule> selectAll() {
        return withRetry("selectAll", null, repository::findAll);
    }

    public boolean exists(JobKey key) {
        return select(key).isPresent();
    }

    public void updateStatus(JobKey key, JobSchedule.JobStatus status) {
        update("updateStatus", key, new Update().set("status", status));
    }

    public void updateRunTime(JobKey key, String runTime) {
        update("updateRunTime", key, new Update().set("runTime", runTime));
    }

    /**
     * Administrative removal. Returns true when a row was deleted.
     */
    public boolean delete(JobKey key) {
        long deleted = withRetry("delete", key, () -> repository.deleteByJobTypeAndServiceAndFrequencyAndScheduledStartDate(
                key.jobType(), key.service(), key.frequency(), key.scheduledStartDate()));
        if (deleted == 0) {
            log.warn("Delete: job {} not found", key.label());
            return false;
        }
        log.info("Deleted job {}", key.label());
        return true;
    }

    private void update(String operation, JobKey key, Update update) {
        update.set("updatedAt", clock.instant());
        long matched = withRetry(operation, key,
                () -> mongoTemplate.updateFirst(byKey(key), update, JobSchedule.class).getMatchedCount());
        if (matched == 0) {
            log.warn("{}: job {} not found", operation, key.label());
        }
    }

    private Optional<JobSchedule> find(JobKey key) {
        return repository.findByJobTypeAndServiceAndFrequencyAndScheduledStartDate(
                key.jobType(), key.service(), key.frequency(), key.scheduledStartDate());
    }

    private static Query byKey(JobKey key) {
        return Query.query(Criteria.where("jobType").is(key.jobType())
                .and("service").is(key.service())
                .and("frequency").is(key.frequency())
                .and("scheduledStartDate").is(key.scheduledStartDate()));
    }

    private <T> T withRetry(String operation, JobKey key, Supplier<T> call) {
        int maxAttempts = storeRetryPolicy.getMaxAttempts();
        String target = key == null ? "all jobs" : key.label();
        for (int attempt = 0; ; attempt++) {
            try {
                return call.get();
            } catch (DuplicateKeyException e) {
                throw e;
            } catch (DataAccessException e) {
                if (attempt + 1 >= maxAttempts) {
                    log.error("Store {} failed for {} after {} attempts", operation, target, maxAttempts, e);
                    throw new TransientStoreException(
                            "Store " + operation + " failed for " + target + " after " + maxAttempts + " attempts", e);
                }
                long delayMs = storeRetryPolicy.delayMs(attempt);
                log.warn("Store {} failed for {} (attempt {}/{}), retrying in {} ms: {}",
                        operation, target, attempt + 1, maxAttempts, delayMs, e.getMessage());
                try {
                    sleeper.sleep(Duration.ofMillis(delayMs));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new TransientStoreException("Interrupted while retrying store " + operation + " for " + target, ie);
                }
            }
        }
    }
}
