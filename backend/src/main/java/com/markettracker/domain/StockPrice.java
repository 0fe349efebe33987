package com.markettracker.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Daily OHLCV aggregate per ticker. Upserted by (tickerSymbol, timestampEnd); a re-fetch replaces the row.
 */
@Document(collection = "stock_prices")
@CompoundIndex(name = "stock_price_key", def = "{'tickerSymbol': 1, 'timestampEnd': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class StockPrice {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String tickerSymbol;
    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;
    private BigDecimal volume;
    /** Epoch millis of the aggregate period end. */
    private long timestampEnd;
    private Instant insertTimestamp;
}
