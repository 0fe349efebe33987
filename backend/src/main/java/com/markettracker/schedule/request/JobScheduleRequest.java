package com.markettracker.schedule.request;

/**
 * Schedule request as received on the wire. Timestamps are ISO-8601 (an instant, or a local date-time taken
 * as UTC); fetch dates are yyyy-MM-dd; weekdays is a serialized list such as {@code ["Mon","Wed","Fri"]}.
 */
public record JobScheduleRequest(
        String jobType,
        String service,
        String owner,
        String frequency,
        String scheduledStart,
        String scheduledEnd,
        String dataFetchStart,
        String dataFetchEnd,
        Integer intervalDays,
        String weekdays
) {}
