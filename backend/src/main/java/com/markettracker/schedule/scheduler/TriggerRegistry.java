package com.markettracker.schedule.scheduler;

import com.markettracker.schedule.config.SchedulerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;

/**
 * Live triggers over the timer pool, keyed by {@link TriggerId}. Arming an id that is already live cancels and
 * replaces it. Timer threads only hand the body to the job-handler pool; a body that throws is logged there.
 * A trigger firing more than misfireGraceTime late is logged and still dispatched.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TriggerRegistry {

    private final Map<TriggerId, ArmedTrigger> armed = new ConcurrentHashMap<>();

    @Qualifier("trigger-timer")
    private final TaskScheduler triggerTimer;
    @Qualifier("job-handler-executor")
    private final Executor jobHandlerExecutor;
    private final SchedulerProperties schedulerProperties;
    private final Clock clock;

    /**
     * Arms a one-shot trigger. A fire time in the past fires as soon as the timer picks it up.
     */
    public void armOnce(TriggerId id, Instant fireAt, Runnable body) {
        ArmedTrigger trigger = new ArmedTrigger(id, fireAt, null);
        replace(id, trigger);
        trigger.future = triggerTimer.schedule(() -> fireOnce(trigger, body), fireAt);
        log.info("Armed {} at {}", id.label(), fireAt);
    }

    /**
     * Arms a repeating trigger; the first tick is at firstFireAt.
     */
    public void armFixedRate(TriggerId id, Instant firstFireAt, Duration period, Runnable body) {
        ArmedTrigger trigger = new ArmedTrigger(id, firstFireAt, period);
        replace(id, trigger);
        trigger.future = triggerTimer.scheduleAtFixedRate(() -> fireRepeating(trigger, body), firstFireAt, period);
        log.info("Armed {} every {} from {}", id.label(), period, firstFireAt);
    }

    /**
     * Cancels a live trigger. Returns false (and logs) when nothing was armed under the id.
     */
    public boolean cancel(TriggerId id) {
        ArmedTrigger trigger = armed.remove(id);
        if (trigger == null) {
            log.info("No live trigger {} to cancel", id.label());
            return false;
        }
        trigger.cancel();
        log.info("Cancelled {}", id.label());
        return true;
    }

    public boolean isArmed(TriggerId id) {
        return armed.containsKey(id);
    }

    public Optional<TriggerSnapshot> find(TriggerId id) {
        return Optional.ofNullable(armed.get(id)).map(ArmedTrigger::snapshot);
    }

    public List<TriggerSnapshot> snapshot() {
        return armed.values().stream()
                .map(ArmedTrigger::snapshot)
                .sorted(Comparator.comparing(TriggerSnapshot::nextFireAt).thenComparing(TriggerSnapshot::label))
                .toList();
    }

    public int cancelAll() {
        int n = 0;
        for (TriggerId id : List.copyOf(armed.keySet())) {
            ArmedTrigger trigger = armed.remove(id);
            if (trigger != null) {
                trigger.cancel();
                n++;
            }
        }
        return n;
    }

    private void replace(TriggerId id, ArmedTrigger trigger) {
        ArmedTrigger previous = armed.put(id, trigger);
        if (previous != null) {
            previous.cancel();
            log.info("Replaced live trigger {}", id.label());
        }
    }

    private void fireOnce(ArmedTrigger trigger, Runnable body) {
        if (!armed.remove(trigger.id, trigger)) {
            return;
        }
        checkMisfire(trigger, trigger.nextFireAt);
        dispatch(trigger.id, body);
    }

    private void fireRepeating(ArmedTrigger trigger, Runnable body) {
        if (trigger.cancelled || armed.get(trigger.id) != trigger) {
            trigger.cancel();
            return;
        }
        Instant intended = trigger.nextFireAt;
        trigger.nextFireAt = intended.plus(trigger.period);
        checkMisfire(trigger, intended);
        dispatch(trigger.id, body);
    }

    private void checkMisfire(ArmedTrigger trigger, Instant intended) {
        Duration late = Duration.between(intended, clock.instant());
        if (late.compareTo(schedulerProperties.getMisfireGraceTime()) > 0) {
            log.warn("Trigger {} misfired by {}, running now", trigger.id.label(), late);
        }
    }

    private void dispatch(TriggerId id, Runnable body) {
        try {
            jobHandlerExecutor.execute(() -> {
                try {
                    log.debug("Firing {}", id.label());
                    body.run();
                } catch (Exception e) {
                    log.error("Trigger {} failed", id.label(), e);
                }
            });
        } catch (RuntimeException e) {
            log.error("Could not dispatch trigger {}", id.label(), e);
        }
    }

    private static final class ArmedTrigger {

        private final TriggerId id;
        private final Duration period;
        private volatile Instant nextFireAt;
        private volatile ScheduledFuture<?> future;
        private volatile boolean cancelled;

        private ArmedTrigger(TriggerId id, Instant nextFireAt, Duration period) {
            this.id = id;
            this.nextFireAt = nextFireAt;
            this.period = period;
        }

        private void cancel() {
            cancelled = true;
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }

        private TriggerSnapshot snapshot() {
            return new TriggerSnapshot(id, nextFireAt, period);
        }
    }
}
