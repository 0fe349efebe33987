package com.markettracker.ingestion.pipeline;

import java.util.List;

/**
 * Idempotent batch persistence. Returns the number of records written.
 */
@FunctionalInterface
public interface RecordSink<T> {

    int persist(List<T> batch);
}
