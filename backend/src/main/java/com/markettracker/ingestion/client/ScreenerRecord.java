package com.markettracker.ingestion.client;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One row of a screener snapshot. All rows of a response share fetchedAt.
 */
public record ScreenerRecord(
        String ticker,
        String companyName,
        BigDecimal price,
        BigDecimal change,
        String industry,
        BigDecimal volume,
        BigDecimal peRatio,
        BigDecimal marketCap,
        BigDecimal revenue,
        Instant fetchedAt
) {}
