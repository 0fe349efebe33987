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
 * One ticker row of a screener snapshot taken at snapshotTime.
 */
@Document(collection = "screener_snapshots")
@CompoundIndex(name = "screener_snapshot_key", def = "{'tickerSymbol': 1, 'snapshotTime': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ScreenerSnapshot {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String tickerSymbol;
    private String companyName;
    private BigDecimal price;
    /** Percent change on the day. */
    private BigDecimal change;
    private String industry;
    private BigDecimal volume;
    private BigDecimal peRatio;
    private BigDecimal marketCap;
    private BigDecimal revenue;
    private Instant snapshotTime;
}
