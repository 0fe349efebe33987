package com.markettracker.ingestion.client;

import java.math.BigDecimal;
import java.time.Instant;

public record TickerProfileRecord(
        String ticker,
        BigDecimal enterpriseValue,
        String marketCapGroup,
        String sector,
        String exchange,
        BigDecimal peForward,
        BigDecimal dividendYield,
        String analystRating,
        BigDecimal priceTarget,
        Instant fetchedAt
) {}
