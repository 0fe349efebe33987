package com.markettracker.ingestion.pipeline;

import com.markettracker.ingestion.client.FetchOutcome;

/**
 * One full-universe request (screener style sources).
 */
@FunctionalInterface
public interface SnapshotFetcher<T> {

    FetchOutcome<T> fetch();
}
