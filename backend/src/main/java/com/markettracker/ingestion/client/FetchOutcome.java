package com.markettracker.ingestion.client;

import java.util.List;
import java.util.function.Supplier;

/**
 * Result of one request to an external source. Only DATA carries records.
 */
public final class FetchOutcome<T> {

    public enum Kind {
        DATA,
        /** Source answered with nothing, e.g. a market holiday. */
        EMPTY,
        /** HTTP 429. */
        RATE_LIMITED,
        HARD_ERROR
    }

    private final Kind kind;
    private final List<T> records;
    private final String message;

    private FetchOutcome(Kind kind, List<T> records, String message) {
        this.kind = kind;
        this.records = records;
        this.message = message;
    }

    public static <T> FetchOutcome<T> data(List<T> records) {
        if (records == null || records.isEmpty()) {
            return empty();
        }
        return new FetchOutcome<>(Kind.DATA, List.copyOf(records), null);
    }

    public static <T> FetchOutcome<T> empty() {
        return new FetchOutcome<>(Kind.EMPTY, List.of(), null);
    }

    public static <T> FetchOutcome<T> rateLimited(String message) {
        return new FetchOutcome<>(Kind.RATE_LIMITED, List.of(), message);
    }

    public static <T> FetchOutcome<T> hardError(String message) {
        return new FetchOutcome<>(Kind.HARD_ERROR, List.of(), message);
    }

    /**
     * Runs a client call that signals failure by exception and maps it to an outcome.
     */
    public static <T> FetchOutcome<T> capture(Supplier<List<T>> call) {
        try {
            return data(call.get());
        } catch (RateLimitException e) {
            return rateLimited(e.getMessage());
        } catch (ExternalSourceException e) {
            return hardError(e.getMessage());
        }
    }

    public Kind kind() {
        return kind;
    }

    public List<T> records() {
        return records;
    }

    public String message() {
        return message;
    }
}
