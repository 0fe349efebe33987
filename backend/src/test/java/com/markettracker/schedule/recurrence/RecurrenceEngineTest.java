package com.markettracker.schedule.recurrence;

import com.markettracker.domain.JobSchedule;
import com.markettracker.domain.ScheduleFrequency;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class RecurrenceEngineTest {

    // 2024-01-03 is a Wednesday
    private static final Instant WED_10AM = Instant.parse("2024-01-03T10:00:00Z");
    private static final Duration TEN_HOURS = Duration.ofHours(10);

    private final RecurrenceEngine engine = new RecurrenceEngine();

    @Test
    @DisplayName("once has no successor")
    void onceDoesNotRecur() {
        assertThat(engine.successor(row(ScheduleFrequency.ONCE, WED_10AM))).isEmpty();
    }

    @Test
    @DisplayName("daily successor is one day later and shifts the data fetch range")
    void dailyAdvancesOneDay() {
        JobSchedule row = row(ScheduleFrequency.RECURRING_DAILY, WED_10AM);
        row.setDataFetchStartDate(LocalDate.of(2024, 1, 2));
        row.setDataFetchEndDate(LocalDate.of(2024, 1, 2));
        row.setStatus(JobSchedule.JobStatus.COMPLETE);
        row.setRunTime("0h 1m 0.00s");

        JobSchedule next = engine.successor(row).orElseThrow();

        assertThat(next.getScheduledStartDate()).isEqualTo(Instant.parse("2024-01-04T10:00:00Z"));
        assertThat(next.getDataFetchStartDate()).isEqualTo(LocalDate.of(2024, 1, 3));
        assertThat(next.getDataFetchEndDate()).isEqualTo(LocalDate.of(2024, 1, 3));
        assertThat(next.getStatus()).isEqualTo(JobSchedule.JobStatus.SCHEDULED);
        assertThat(next.getRunTime()).isNull();
        assertThat(next.getOwner()).isEqualTo("alice");
        assertThat(next.getJobType()).isEqualTo("api_fetch");
        assertThat(next.getFrequency()).isEqualTo(ScheduleFrequency.RECURRING_DAILY);
        assertThat(row.getScheduledStartDate()).isEqualTo(WED_10AM);
    }

    @Test
    @DisplayName("weekday set {Mon,Wed,Fri} from Wednesday goes to Friday, start and end moved by the same offset")
    void weekdayWednesdayToFriday() {
        JobSchedule row = windowed(WED_10AM, EnumSet.of(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY, DayOfWeek.FRIDAY));

        JobSchedule next = engine.successor(row).orElseThrow();

        assertThat(next.getScheduledStartDate()).isEqualTo(Instant.parse("2024-01-05T10:00:00Z"));
        assertThat(next.getScheduledEndDate()).isEqualTo(Instant.parse("2024-01-05T16:00:00Z"));
        assertThat(next.getWeekdays()).containsExactlyInAnyOrder(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY, DayOfWeek.FRIDAY);
    }

    @Test
    @DisplayName("weekday set {Mon,Wed,Fri} from Saturday goes to Monday")
    void weekdaySaturdayToMonday() {
        JobSchedule row = windowed(Instant.parse("2024-01-06T10:00:00Z"),
                EnumSet.of(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY, DayOfWeek.FRIDAY));

        assertThat(engine.successor(row).map(JobSchedule::getScheduledStartDate))
                .contains(Instant.parse("2024-01-08T10:00:00Z"));
    }

    @Test
    @DisplayName("single-day set goes to the same weekday next week")
    void singleWeekdayNextWeek() {
        JobSchedule row = windowed(WED_10AM, EnumSet.of(DayOfWeek.WEDNESDAY));

        assertThat(engine.successor(row).map(JobSchedule::getScheduledStartDate))
                .contains(Instant.parse("2024-01-10T10:00:00Z"));
    }

    @Test
    @DisplayName("interval advances start and end by intervalDays")
    void intervalAdvances() {
        JobSchedule row = windowed(WED_10AM, null);
        row.setIntervalDays(3);

        JobSchedule next = engine.successor(row).orElseThrow();

        assertThat(next.getScheduledStartDate()).isEqualTo(Instant.parse("2024-01-06T10:00:00Z"));
        assertThat(next.getScheduledEndDate()).isEqualTo(Instant.parse("2024-01-06T16:00:00Z"));
        assertThat(next.getIntervalDays()).isEqualTo(3);
    }

    @Test
    @DisplayName("weekdays take precedence over interval")
    void weekdaysBeforeInterval() {
        JobSchedule row = windowed(WED_10AM, EnumSet.of(DayOfWeek.THURSDAY));
        row.setIntervalDays(5);

        assertThat(engine.successor(row).map(JobSchedule::getScheduledStartDate))
                .contains(Instant.parse("2024-01-04T10:00:00Z"));
    }

    @Test
    @DisplayName("custom_schedule without weekdays or interval does not recur")
    void customWithoutRuleDoesNotRecur() {
        assertThat(engine.successor(windowed(WED_10AM, null))).isEmpty();
    }

    @Test
    @DisplayName("successor is a pure function of the row")
    void successorIsDeterministic() {
        JobSchedule row = row(ScheduleFrequency.RECURRING_DAILY_PM, Instant.parse("2024-01-03T23:00:00Z"));
        Optional<JobSchedule> a = engine.successor(row);
        Optional<JobSchedule> b = engine.successor(row);
        assertThat(a.orElseThrow().key()).isEqualTo(b.orElseThrow().key());
    }

    @Test
    @DisplayName("missed AM row still inside its window is restarted")
    void missedWithinWindowRestarts() {
        JobSchedule row = row(ScheduleFrequency.RECURRING_DAILY_AM, Instant.parse("2024-01-03T11:00:00Z"));

        MissedWindowDecision decision = engine.evaluateMissed(row, Instant.parse("2024-01-03T21:00:00Z"), TEN_HOURS);

        assertThat(decision.action()).isEqualTo(MissedWindowDecision.Action.RESTART);
        assertThat(decision.successor()).isEmpty();
    }

    @Test
    @DisplayName("missed AM row past its window is skipped; successor is tomorrow's slot")
    void missedPastWindowSkipsToNextSlot() {
        JobSchedule row = row(ScheduleFrequency.RECURRING_DAILY_AM, Instant.parse("2024-01-03T11:00:00Z"));

        MissedWindowDecision decision = engine.evaluateMissed(row, Instant.parse("2024-01-03T22:00:00Z"), TEN_HOURS);

        assertThat(decision.isSkip()).isTrue();
        assertThat(decision.successor().map(JobSchedule::getScheduledStartDate))
                .contains(Instant.parse("2024-01-04T11:00:00Z"));
    }

    @Test
    @DisplayName("row missed by days rolls forward to today's slot when it is still ahead")
    void missedByDaysRollsToTodaysSlot() {
        JobSchedule row = row(ScheduleFrequency.RECURRING_DAILY_PM, Instant.parse("2024-01-01T23:00:00Z"));

        MissedWindowDecision decision = engine.evaluateMissed(row, Instant.parse("2024-01-05T09:00:00Z"), TEN_HOURS);

        assertThat(decision.successor().map(JobSchedule::getScheduledStartDate))
                .contains(Instant.parse("2024-01-05T23:00:00Z"));
    }

    @Test
    @DisplayName("frequencies without a daily window always restart")
    void nonWindowFrequencyRestarts() {
        JobSchedule row = row(ScheduleFrequency.RECURRING_DAILY, Instant.parse("2023-12-01T11:00:00Z"));

        assertThat(engine.evaluateMissed(row, WED_10AM, TEN_HOURS).action())
                .isEqualTo(MissedWindowDecision.Action.RESTART);
    }

    private static JobSchedule row(ScheduleFrequency frequency, Instant start) {
        JobSchedule row = new JobSchedule();
        row.setJobType("api_fetch");
        row.setService("polygon_io");
        row.setOwner("alice");
        row.setFrequency(frequency);
        row.setScheduledStartDate(start);
        row.setStatus(JobSchedule.JobStatus.SCHEDULED);
        return row;
    }

    private static JobSchedule windowed(Instant start, EnumSet<DayOfWeek> weekdays) {
        JobSchedule row = new JobSchedule();
        row.setJobType("data_scrape");
        row.setService("stock_analysis");
        row.setOwner("alice");
        row.setFrequency(ScheduleFrequency.CUSTOM_SCHEDULE);
        row.setScheduledStartDate(start);
        row.setScheduledEndDate(start.plus(Duration.ofHours(6)));
        row.setWeekdays(weekdays);
        row.setStatus(JobSchedule.JobStatus.SCHEDULED);
        return row;
    }
}
