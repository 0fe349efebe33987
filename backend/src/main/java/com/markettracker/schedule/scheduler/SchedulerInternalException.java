package com.markettracker.schedule.scheduler;

/**
 * Thrown inside a trigger body when the scheduler cannot act on a job (unknown kind, no handler, row gone).
 * Caught and logged at the trigger boundary.
 */
public class SchedulerInternalException extends RuntimeException {

    public SchedulerInternalException(String message) {
        super(message);
    }

    public SchedulerInternalException(String message, Throwable cause) {
        super(message, cause);
    }
}
