package com.markettracker.schedule.request;

import lombok.Getter;

/**
 * Thrown when a schedule request is rejected. errorCode is one of the constants below.
 */
@Getter
public class ScheduleRequestException extends RuntimeException {

    public static final String UNKNOWN_JOB_KIND = "UNKNOWN_JOB_KIND";
    public static final String UNKNOWN_FREQUENCY = "UNKNOWN_FREQUENCY";
    public static final String INVALID_WINDOW = "INVALID_WINDOW";
    public static final String INVALID_FETCH_RANGE = "INVALID_FETCH_RANGE";
    public static final String INVALID_WEEKDAYS = "INVALID_WEEKDAYS";
    public static final String INVALID_INTERVAL = "INVALID_INTERVAL";

    private final String errorCode;

    public ScheduleRequestException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ScheduleRequestException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
