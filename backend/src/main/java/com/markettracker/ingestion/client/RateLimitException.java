package com.markettracker.ingestion.client;

/**
 * Thrown when an external source answers HTTP 429 or the local limiter for it times out.
 */
public class RateLimitException extends RuntimeException {

    public RateLimitException(String message) {
        super(message);
    }

    public RateLimitException(String message, Throwable cause) {
        super(message, cause);
    }
}
