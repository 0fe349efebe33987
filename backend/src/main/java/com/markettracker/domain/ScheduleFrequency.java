package com.markettracker.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * How a job schedule repeats. Wire values match the persisted/requested strings ({@code recurring_daily_am}).
 */
public enum ScheduleFrequency {
    ONCE("once"),
    RECURRING_DAILY("recurring_daily"),
    RECURRING_DAILY_AM("recurring_daily_am"),
    RECURRING_DAILY_PM("recurring_daily_pm"),
    /** Windowed: polled between scheduled start and end, optionally repeating on weekdays or every N days. */
    CUSTOM_SCHEDULE("custom_schedule");

    private final String wireValue;

    ScheduleFrequency(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /** Daily rule: successor one day later. */
    public boolean isDaily() {
        return this == RECURRING_DAILY || this == RECURRING_DAILY_AM || this == RECURRING_DAILY_PM;
    }

    /** AM/PM slots that carry an eligibility window after the scheduled time. */
    public boolean isDailyWindow() {
        return this == RECURRING_DAILY_AM || this == RECURRING_DAILY_PM;
    }

    public static Optional<ScheduleFrequency> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String v = value.strip();
        return Arrays.stream(values())
                .filter(f -> f.wireValue.equalsIgnoreCase(v) || f.name().equalsIgnoreCase(v))
                .findFirst();
    }
}
