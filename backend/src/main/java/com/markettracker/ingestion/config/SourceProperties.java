package com.markettracker.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * External data sources.
 */
@ConfigurationProperties(prefix = "markettracker.ingestion.sources")
@NoArgsConstructor
@Getter
@Setter
public class SourceProperties {

    private Polygon polygon = new Polygon();
    private StockAnalysis stockAnalysis = new StockAnalysis();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Polygon {

        private String baseUrl = "https://api.polygon.io";

        /** Service name the API key is stored under in api_keys. */
        private String apiKeyService = "polygon_io";
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class StockAnalysis {

        /** Full-universe screener snapshot. Response: data.data[]. */
        private String screenerUrl = "https://api.stockanalysis.com/api/screener/s/f?m=s&s=asc"
                + "&c=s,revenue,marketCap,n,industry,price,change,volume,peRatio&cn=all&p=1&i=stocks&sc=s";

        /** Same screener with per-ticker profile columns. */
        private String tickerProfileUrl = "https://api.stockanalysis.com/api/screener/s/f?m=s&s=asc"
                + "&c=s,enterpriseValue,marketCapCategory,sector,exchange,peForward,dividendYield,analystRatings,priceTarget"
                + "&cn=all&p=1&i=stocks&sc=s";

        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) "
                + "Chrome/87.0.4280.88 Safari/537.36";

        /** Local limiter on the scrape endpoint. */
        private int requestsPerMinute = 6;

        /** How long a caller may wait for a local permit before the request fails. */
        private long localLimiterTimeoutMs = 30_000;

        /** Local limiter waits at or above this are logged. */
        private long localLimiterLogThresholdMs = 1_000;

        /** Attempts on network errors within one request (exponential backoff, capped). */
        private int maxAttempts = 3;

        private long retryBaseDelayMs = 5_000;

        private long retryMaxDelayMs = 600_000;
    }
}
