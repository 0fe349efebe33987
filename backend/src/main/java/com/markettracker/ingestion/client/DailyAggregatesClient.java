package com.markettracker.ingestion.client;

import java.time.LocalDate;

/**
 * Grouped daily aggregates for the whole market, one request per calendar day. Never throws: failures are
 * reported as RATE_LIMITED or HARD_ERROR outcomes.
 */
public interface DailyAggregatesClient {

    FetchOutcome<DailyAggregateRecord> fetch(LocalDate date);
}
