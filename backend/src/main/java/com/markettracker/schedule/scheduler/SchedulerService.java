package com.markettracker.schedule.scheduler;

import com.markettracker.common.RunTimeFormatter;
import com.markettracker.domain.JobKey;
import com.markettracker.domain.JobKind;
import com.markettracker.domain.JobSchedule;
import com.markettracker.domain.ScheduleFrequency;
import com.markettracker.schedule.config.SchedulerProperties;
import com.markettracker.schedule.recurrence.MissedWindowDecision;
import com.markettracker.schedule.recurrence.RecurrenceService;
import com.markettracker.schedule.store.JobScheduleStore;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Turns persisted job schedule rows into runtime triggers and drives each row's lifecycle.
 * <p>
 * Reconciliation (startup and after every schedule request) arms future rows at their start, restarts missed
 * SCHEDULED/RUNNING rows after restartDelay, and applies the missed-window policy to AM/PM rows.
 * One-shot jobs run their {@link JobHandler} on the pipeline pool; windowed (custom_schedule) jobs are an
 * ENABLE trigger that arms a fixed-rate POLL and a DISABLE trigger at the window end.
 * <p>
 * Jobs currently running or polling are tracked in memory and skipped by reconciliation.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SchedulerService {

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Set<JobKey> inFlight = ConcurrentHashMap.newKeySet();
    private final Map<JobKey, Instant> pollingStartedAt = new ConcurrentHashMap<>();

    private final JobScheduleStore jobScheduleStore;
    private final RecurrenceService recurrenceService;
    private final TriggerRegistry triggerRegistry;
    private final List<JobHandler> jobHandlers;
    private final List<PollingJobHandler> pollingJobHandlers;
    private final SchedulerProperties schedulerProperties;
    private final Clock clock;
    @Qualifier("pipeline-executor")
    private final Executor pipelineExecutor;

    @EventListener(ApplicationReadyEvent.class)
    @Order(Ordered.LOWEST_PRECEDENCE)
    public void onApplicationReady() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        log.info("Scheduler starting: {} job handler(s), {} polling handler(s)", jobHandlers.size(), pollingJobHandlers.size());
        reconcile();
        logTriggers();
    }

    /**
     * Arms triggers for every pending row. Returns the number of rows armed.
     */
    public synchronized int reconcile() {
        Instant now = clock.instant();
        List<JobSchedule> rows;
        try {
            rows = jobScheduleStore.selectAll();
        } catch (RuntimeException e) {
            log.error("Reconciliation skipped: could not load job schedules", e);
            return 0;
        }
        int armedCount = 0;
        for (JobSchedule row : rows) {
            try {
                if (reconcileRow(row, now)) {
                    armedCount++;
                }
            } catch (RuntimeException e) {
                log.error("Reconciliation failed for {}", row.key().label(), e);
            }
        }
        log.info("Reconciled {} job schedule row(s), {} armed", rows.size(), armedCount);
        return armedCount;
    }

    private boolean reconcileRow(JobSchedule row, Instant now) {
        JobKey key = row.key();
        if (!isPending(row) || inFlight.contains(key)) {
            return false;
        }
        Optional<JobKind> kind = JobKind.of(row.getJobType(), row.getService());
        if (kind.isEmpty()) {
            log.warn("Job {} has unknown job kind, not armed", key.label());
            return false;
        }
        boolean windowed = isWindowed(kind.get(), row);
        Instant start = row.getScheduledStartDate();
        if (start.isAfter(now)) {
            arm(row, windowed, start);
            return true;
        }
        if (row.getFrequency().isDailyWindow()) {
            MissedWindowDecision decision = recurrenceService.evaluateMissed(row, now);
            if (decision.isSkip()) {
                Optional<JobSchedule> next = recurrenceService.skipAndRollForward(row, now);
                next.ifPresent(this::arm);
                return next.isPresent();
            }
        }
        if (windowed && (row.getScheduledEndDate() == null || !row.getScheduledEndDate().isAfter(now))) {
            log.warn("Windowed job {} missed its whole window (end {}), ignoring", key.label(), row.getScheduledEndDate());
            return false;
        }
        Instant restartAt = now.plus(schedulerProperties.getRestartDelay());
        TriggerId id = windowed ? TriggerId.enable(key) : TriggerId.job(key);
        Optional<Instant> armedAt = triggerRegistry.find(id).map(TriggerSnapshot::nextFireAt);
        if (armedAt.isPresent() && !armedAt.get().isAfter(restartAt)) {
            log.debug("Missed job {} already armed for {}, keeping it", key.label(), armedAt.get());
            return false;
        }
        log.info("Missed job {} (status {}, start {}) will restart at {}", key.label(), row.getStatus(), start, restartAt);
        arm(row, windowed, restartAt);
        return true;
    }

    /**
     * Arms a single row (no reconciliation of the rest). Used when a successor is created.
     */
    public void arm(JobSchedule row) {
        JobKind kind = kindOf(row);
        arm(row, isWindowed(kind, row), row.getScheduledStartDate());
    }

    private void arm(JobSchedule row, boolean windowed, Instant at) {
        JobKey key = row.key();
        if (windowed) {
            triggerRegistry.armOnce(TriggerId.enable(key), at, () -> enable(key));
        } else {
            triggerRegistry.armOnce(TriggerId.job(key), at, () -> runJob(key));
        }
    }

    void runJob(JobKey key) {
        JobSchedule row = loadPending(key);
        if (row == null) {
            return;
        }
        JobKind kind = kindOf(row);
        JobHandler handler = jobHandlers.stream()
                .filter(h -> h.supports(kind))
                .findFirst()
                .orElseThrow(() -> new SchedulerInternalException("No job handler for " + kind + " (" + key.label() + ")"));
        if (!inFlight.add(key)) {
            log.warn("Job {} is already running, trigger ignored", key.label());
            return;
        }
        try {
            jobScheduleStore.updateStatus(key, JobSchedule.JobStatus.RUNNING);
            Instant startedAt = clock.instant();
            log.info("Job {} started ({})", key.label(), kind);
            CompletableFuture.supplyAsync(() -> handler.run(row), pipelineExecutor)
                    .whenComplete((outcome, error) -> {
                        try {
                            onJobFinished(row, startedAt, outcome, error);
                        } finally {
                            inFlight.remove(key);
                        }
                    });
        } catch (RuntimeException e) {
            inFlight.remove(key);
            throw e;
        }
    }

    private void onJobFinished(JobSchedule row, Instant startedAt, JobRunOutcome outcome, Throwable error) {
        JobKey key = row.key();
        try {
            if (error != null) {
                log.error("Job {} threw, left RUNNING for the next reconciliation", key.label(), error);
                return;
            }
            if (outcome != JobRunOutcome.COMPLETED) {
                jobScheduleStore.updateStatus(key, JobSchedule.JobStatus.FAILED);
                log.warn("Job {} FAILED, no successor scheduled", key.label());
                return;
            }
            complete(row, startedAt);
        } catch (RuntimeException e) {
            log.error("Could not record completion of job {}", key.label(), e);
        }
    }

    void enable(JobKey key) {
        JobSchedule row = loadPending(key);
        if (row == null) {
            return;
        }
        JobKind kind = kindOf(row);
        PollingJobHandler handler = pollingJobHandlers.stream()
                .filter(h -> h.supports(kind))
                .findFirst()
                .orElseThrow(() -> new SchedulerInternalException("No polling handler for " + kind + " (" + key.label() + ")"));
        Instant end = row.getScheduledEndDate();
        if (end == null) {
            throw new SchedulerInternalException("Windowed job " + key.label() + " has no end date");
        }
        if (!inFlight.add(key)) {
            log.warn("Job {} is already polling, enable ignored", key.label());
            return;
        }
        TriggerId pollId = TriggerId.poll(key);
        try {
            Instant now = clock.instant();
            jobScheduleStore.updateStatus(key, JobSchedule.JobStatus.RUNNING);
            pollingStartedAt.put(key, now);
            triggerRegistry.armFixedRate(pollId, now, schedulerProperties.getPollingInterval(), () -> pollTick(pollId, row, handler));
            triggerRegistry.armOnce(TriggerId.disable(key), end.isAfter(now) ? end : now, () -> disable(key));
            log.info("Job {} enabled, polling every {} until {}", key.label(), schedulerProperties.getPollingInterval(), end);
        } catch (RuntimeException e) {
            if (triggerRegistry.isArmed(pollId)) {
                triggerRegistry.cancel(pollId);
            }
            pollingStartedAt.remove(key);
            inFlight.remove(key);
            throw e;
        }
    }

    private void pollTick(TriggerId pollId, JobSchedule row, PollingJobHandler handler) {
        if (!triggerRegistry.isArmed(pollId)) {
            return;
        }
        pipelineExecutor.execute(() -> {
            try {
                handler.poll(row);
            } catch (Exception e) {
                log.warn("Poll tick for {} failed", row.key().label(), e);
            }
        });
    }

    void disable(JobKey key) {
        try {
            if (!triggerRegistry.cancel(TriggerId.poll(key))) {
                log.info("Disable {}: poll trigger already gone", key.label());
            }
            JobSchedule row = jobScheduleStore.select(key)
                    .orElseThrow(() -> new SchedulerInternalException("Job " + key.label() + " no longer exists"));
            Instant enabledAt = pollingStartedAt.remove(key);
            complete(row, enabledAt != null ? enabledAt : row.getScheduledStartDate());
        } finally {
            inFlight.remove(key);
        }
    }

    /**
     * Records run time, marks COMPLETE, inserts and arms the successor.
     */
    private void complete(JobSchedule row, Instant startedAt) {
        JobKey key = row.key();
        String runTime = RunTimeFormatter.format(Duration.between(startedAt, clock.instant()));
        jobScheduleStore.updateRunTime(key, runTime);
        jobScheduleStore.updateStatus(key, JobSchedule.JobStatus.COMPLETE);
        log.info("Job {} COMPLETE in {}", key.label(), runTime);
        recurrenceService.scheduleSuccessor(row).ifPresent(this::arm);
    }

    public List<TriggerSnapshot> listTriggers() {
        return triggerRegistry.snapshot();
    }

    public void logTriggers() {
        List<TriggerSnapshot> triggers = listTriggers();
        log.info("{} live trigger(s)", triggers.size());
        for (TriggerSnapshot t : triggers) {
            log.info("  {} next={}{}", t.label(), t.nextFireAt(), t.period() == null ? "" : " every " + t.period());
        }
    }

    /**
     * Persisted row and live triggers of one job, also written to the log.
     */
    public JobInspection inspect(JobKey key) {
        Optional<JobSchedule> row = jobScheduleStore.select(key);
        List<TriggerSnapshot> triggers = Stream.of(TriggerRole.values())
                .map(role -> triggerRegistry.find(new TriggerId(role, key)))
                .flatMap(Optional::stream)
                .toList();
        JobInspection inspection = new JobInspection(key, row, triggers, inFlight.contains(key));
        log.info("Inspect {}: status={} runTime={} inFlight={} triggers={}", key.label(),
                row.map(JobSchedule::getStatus).orElse(null), row.map(JobSchedule::getRunTime).orElse(null),
                inspection.inFlight(), triggers.stream().map(TriggerSnapshot::label).toList());
        return inspection;
    }

    @PreDestroy
    public void shutdown() {
        int cancelled = triggerRegistry.cancelAll();
        started.set(false);
        log.info("Scheduler shut down, {} trigger(s) cancelled", cancelled);
    }

    private JobSchedule loadPending(JobKey key) {
        JobSchedule row = jobScheduleStore.select(key)
                .orElseThrow(() -> new SchedulerInternalException("Job " + key.label() + " no longer exists"));
        if (!isPending(row)) {
            log.info("Job {} is {}, trigger ignored", key.label(), row.getStatus());
            return null;
        }
        return row;
    }

    private static JobKind kindOf(JobSchedule row) {
        return JobKind.of(row.getJobType(), row.getService())
                .orElseThrow(() -> new SchedulerInternalException("Unknown job kind for " + row.key().label()));
    }

    private static boolean isWindowed(JobKind kind, JobSchedule row) {
        return kind == JobKind.SCREENER_SCRAPE && row.getFrequency() == ScheduleFrequency.CUSTOM_SCHEDULE;
    }

    private static boolean isPending(JobSchedule row) {
        return row.getStatus() == JobSchedule.JobStatus.SCHEDULED || row.getStatus() == JobSchedule.JobStatus.RUNNING;
    }
}
