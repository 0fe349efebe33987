package com.markettracker.schedule.scheduler;

import com.markettracker.domain.JobKey;
import com.markettracker.domain.ScheduleFrequency;
import com.markettracker.schedule.config.SchedulerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class TriggerRegistryTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final JobKey KEY = new JobKey("data_scrape", "stock_analysis", ScheduleFrequency.CUSTOM_SCHEDULE,
            Instant.parse("2024-03-01T14:30:00Z"));

    @Mock
    TaskScheduler taskScheduler;

    private final List<Scheduled> scheduled = new ArrayList<>();
    TriggerRegistry registry;

    record Scheduled(Runnable task, Instant at, Duration period, ScheduledFuture<?> future) {
    }

    @BeforeEach
    void setUp() {
        lenient().doAnswer(inv -> capture(inv.getArgument(0), inv.getArgument(1), null))
                .when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
        lenient().doAnswer(inv -> capture(inv.getArgument(0), inv.getArgument(1), inv.getArgument(2)))
                .when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Instant.class), any(Duration.class));
        registry = new TriggerRegistry(taskScheduler, Runnable::run, new SchedulerProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("one-shot trigger runs its body once and is no longer armed")
    void oneShotFires() {
        AtomicInteger runs = new AtomicInteger();
        registry.armOnce(TriggerId.job(KEY), KEY.scheduledStartDate(), runs::incrementAndGet);

        assertThat(registry.isArmed(TriggerId.job(KEY))).isTrue();
        assertThat(scheduled.get(0).at()).isEqualTo(KEY.scheduledStartDate());
        scheduled.get(0).task().run();

        assertThat(runs.get()).isEqualTo(1);
        assertThat(registry.isArmed(TriggerId.job(KEY))).isFalse();
    }

    @Test
    @DisplayName("arming the same id again cancels and replaces the live trigger")
    void rearmReplaces() {
        AtomicInteger first = new AtomicInteger();
        AtomicInteger second = new AtomicInteger();
        registry.armOnce(TriggerId.job(KEY), NOW.plusSeconds(60), first::incrementAndGet);
        registry.armOnce(TriggerId.job(KEY), NOW.plusSeconds(120), second::incrementAndGet);

        verify(scheduled.get(0).future()).cancel(false);
        scheduled.get(0).task().run();
        scheduled.get(1).task().run();

        assertThat(first.get()).isZero();
        assertThat(second.get()).isEqualTo(1);
        assertThat(registry.snapshot()).isEmpty();
    }

    @Test
    @DisplayName("cancel reports whether a trigger was live; a cancelled trigger never runs")
    void cancel() {
        AtomicInteger runs = new AtomicInteger();
        registry.armOnce(TriggerId.disable(KEY), NOW.plusSeconds(60), runs::incrementAndGet);

        assertThat(registry.cancel(TriggerId.disable(KEY))).isTrue();
        assertThat(registry.cancel(TriggerId.disable(KEY))).isFalse();
        scheduled.get(0).task().run();

        assertThat(runs.get()).isZero();
    }

    @Test
    @DisplayName("fixed-rate trigger advances its next fire time and stops after cancel")
    void fixedRate() {
        AtomicInteger polls = new AtomicInteger();
        TriggerId id = TriggerId.poll(KEY);
        registry.armFixedRate(id, NOW, Duration.ofMinutes(5), polls::incrementAndGet);

        scheduled.get(0).task().run();
        scheduled.get(0).task().run();
        assertThat(registry.find(id).map(TriggerSnapshot::nextFireAt)).contains(NOW.plus(Duration.ofMinutes(10)));

        registry.cancel(id);
        scheduled.get(0).task().run();

        assertThat(polls.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("a failing body is logged, not propagated to the timer")
    void failingBodyContained() {
        registry.armOnce(TriggerId.job(KEY), NOW, () -> {
            throw new IllegalStateException("boom");
        });

        assertThatCode(() -> scheduled.get(0).task().run()).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("snapshot lists live triggers by next fire time")
    void snapshotSorted() {
        registry.armOnce(TriggerId.disable(KEY), NOW.plusSeconds(600), () -> { });
        registry.armFixedRate(TriggerId.poll(KEY), NOW, Duration.ofMinutes(5), () -> { });

        assertThat(registry.snapshot()).extracting(TriggerSnapshot::role)
                .containsExactly(TriggerRole.POLL, TriggerRole.DISABLE);
        assertThat(registry.snapshot().get(0).label()).startsWith("poll-job-data_scrape-stock_analysis-custom_schedule-");
        assertThat(registry.cancelAll()).isEqualTo(2);
        assertThat(registry.snapshot()).isEmpty();
    }

    @Test
    @DisplayName("a trigger firing past the misfire grace time still runs its body")
    void misfiredTriggerStillDispatched() {
        SchedulerProperties properties = new SchedulerProperties();
        MovableClock clock = new MovableClock(NOW);
        TriggerRegistry lateRegistry = new TriggerRegistry(taskScheduler, Runnable::run, properties, clock);
        AtomicInteger runs = new AtomicInteger();
        Instant fireAt = NOW.plusSeconds(60);
        lateRegistry.armOnce(TriggerId.job(KEY), fireAt, runs::incrementAndGet);

        clock.set(fireAt.plus(properties.getMisfireGraceTime()).plus(Duration.ofMinutes(10)));
        scheduled.get(0).task().run();

        assertThat(runs.get()).isEqualTo(1);
        assertThat(lateRegistry.isArmed(TriggerId.job(KEY))).isFalse();
    }

    @Test
    @DisplayName("a late fixed-rate tick is dispatched and the schedule keeps its cadence")
    void misfiredTickStillDispatched() {
        MovableClock clock = new MovableClock(NOW);
        TriggerRegistry lateRegistry = new TriggerRegistry(taskScheduler, Runnable::run, new SchedulerProperties(), clock);
        AtomicInteger polls = new AtomicInteger();
        TriggerId id = TriggerId.poll(KEY);
        lateRegistry.armFixedRate(id, NOW, Duration.ofMinutes(5), polls::incrementAndGet);

        clock.set(NOW.plus(Duration.ofMinutes(4)));
        scheduled.get(0).task().run();

        assertThat(polls.get()).isEqualTo(1);
        assertThat(lateRegistry.find(id).map(TriggerSnapshot::nextFireAt)).contains(NOW.plus(Duration.ofMinutes(5)));
    }

    private ScheduledFuture<?> capture(Runnable task, Instant at, Duration period) {
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        scheduled.add(new Scheduled(task, at, period, future));
        return future;
    }

    static final class MovableClock extends Clock {

        private volatile Instant now;

        MovableClock(Instant now) {
            this.now = now;
        }

        void set(Instant now) {
            this.now = now;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
