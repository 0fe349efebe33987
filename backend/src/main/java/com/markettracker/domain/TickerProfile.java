package com.markettracker.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Latest descriptive data per ticker; one document per symbol.
 */
@Document(collection = "ticker_profiles")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TickerProfile {

    @Id
    @EqualsAndHashCode.Include
    private String tickerSymbol;
    private BigDecimal enterpriseValue;
    private String marketCapGroup;
    private String sector;
    private String exchange;
    private BigDecimal peForward;
    private BigDecimal dividendYield;
    private String analystRating;
    private BigDecimal priceTarget;
    private Instant updatedAt;
}
