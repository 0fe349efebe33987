package com.markettracker.schedule.store;

/**
 * Thrown when a job schedule store call still fails after its bounded retry.
 */
public class TransientStoreException extends RuntimeException {

    public TransientStoreException(String message) {
        super(message);
    }

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
