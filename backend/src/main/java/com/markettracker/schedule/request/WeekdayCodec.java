package com.markettracker.schedule.request;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.DayOfWeek;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Parses weekday lists like {@code ["Mon","Wed"]}. Three-letter abbreviations and full names are accepted,
 * case-insensitively.
 */
final class WeekdayCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private WeekdayCodec() {
    }

    static Set<DayOfWeek> parse(String json) {
        String[] names;
        try {
            names = MAPPER.readValue(json, String[].class);
        } catch (JsonProcessingException e) {
            throw new ScheduleRequestException(ScheduleRequestException.INVALID_WEEKDAYS,
                    "weekdays is not a list of day names: " + json, e);
        }
        if (names == null || names.length == 0) {
            throw new ScheduleRequestException(ScheduleRequestException.INVALID_WEEKDAYS, "weekdays is empty");
        }
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        for (String name : names) {
            days.add(dayOf(name));
        }
        return days;
    }

    private static DayOfWeek dayOf(String name) {
        String n = name == null ? "" : name.strip().toUpperCase(Locale.ROOT);
        for (DayOfWeek d : DayOfWeek.values()) {
            if (n.length() == 3 ? d.name().startsWith(n) : d.name().equals(n)) {
                return d;
            }
        }
        throw new ScheduleRequestException(ScheduleRequestException.INVALID_WEEKDAYS, "Unknown weekday: " + name);
    }
}
