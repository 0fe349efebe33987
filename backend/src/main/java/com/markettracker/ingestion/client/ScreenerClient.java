package com.markettracker.ingestion.client;

import java.util.List;

/**
 * Screener scrape endpoint. Each call is one full-universe request.
 *
 * @throws RateLimitException on HTTP 429
 * @throws ExternalSourceException on any other failure
 */
public interface ScreenerClient {

    List<ScreenerRecord> fetchSnapshot();

    List<TickerProfileRecord> fetchTickerProfiles();
}
