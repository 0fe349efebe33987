package com.markettracker.ingestion.pipeline;

import com.markettracker.ingestion.client.FetchOutcome;

import java.time.LocalDate;

@FunctionalInterface
public interface DayFetcher<T> {

    FetchOutcome<T> fetch(LocalDate day);
}
