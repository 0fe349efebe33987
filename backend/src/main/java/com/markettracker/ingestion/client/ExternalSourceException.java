package com.markettracker.ingestion.client;

/**
 * Thrown when an external source call fails for a reason other than rate limiting (HTTP error, network, bad payload).
 */
public class ExternalSourceException extends RuntimeException {

    public ExternalSourceException(String message) {
        super(message);
    }

    public ExternalSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
