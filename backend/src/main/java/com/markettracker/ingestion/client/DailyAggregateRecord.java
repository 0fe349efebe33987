package com.markettracker.ingestion.client;

import java.math.BigDecimal;

/**
 * One ticker's aggregate for one trading day. timestampEnd is epoch millis of the period end.
 */
public record DailyAggregateRecord(
        String ticker,
        BigDecimal open,
        BigDecimal high,
        BigDecimal low,
        BigDecimal close,
        BigDecimal volume,
        long timestampEnd
) {}
