package com.markettracker.ingestion.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.markettracker.ingestion.config.SourceProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Grouped daily aggregates: GET /v2/aggs/grouped/locale/us/market/stocks/{date}?adjusted=true with the API key as a
 * bearer token. A response with resultsCount 0 (weekend, holiday) is EMPTY.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PolygonDailyAggregatesClient implements DailyAggregatesClient {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SourceProperties sourceProperties;
    private final WebClient.Builder webClientBuilder;
    private final ApiKeyProvider apiKeyProvider;

    @Override
    public FetchOutcome<DailyAggregateRecord> fetch(LocalDate date) {
        SourceProperties.Polygon polygon = sourceProperties.getPolygon();
        Optional<String> apiKey = apiKeyProvider.apiKeyFor(polygon.getApiKeyService());
        if (apiKey.isEmpty()) {
            return FetchOutcome.hardError("No API key stored for " + polygon.getApiKeyService());
        }
        String dateStr = date.format(DATE_FORMAT);
        String url = polygon.getBaseUrl() + "/v2/aggs/grouped/locale/us/market/stocks/" + dateStr + "?adjusted=true";
        try {
            String response = webClientBuilder.build().get()
                    .uri(url)
                    .headers(h -> h.setBearerAuth(apiKey.get()))
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
            return parseResponse(response);
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                return FetchOutcome.rateLimited("HTTP 429 for " + dateStr);
            }
            log.warn("Daily aggregates failed for {}: HTTP {}", dateStr, e.getStatusCode().value());
            return FetchOutcome.hardError("HTTP " + e.getStatusCode().value() + " for " + dateStr);
        } catch (Exception e) {
            log.warn("Daily aggregates error for {}: {}", dateStr, e.getClass().getSimpleName());
            return FetchOutcome.hardError(e.getClass().getSimpleName() + " for " + dateStr);
        }
    }

    static FetchOutcome<DailyAggregateRecord> parseResponse(String json) {
        if (json == null || json.isBlank()) {
            return FetchOutcome.empty();
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (Exception e) {
            return FetchOutcome.hardError("Unparseable response: " + e.getMessage());
        }
        JsonNode results = root.path("results");
        if (root.path("resultsCount").asInt(0) == 0 || !results.isArray() || results.isEmpty()) {
            return FetchOutcome.empty();
        }
        List<DailyAggregateRecord> records = new ArrayList<>(results.size());
        for (JsonNode r : results) {
            String ticker = r.path("T").asText(null);
            if (ticker == null || ticker.isBlank() || !r.path("t").isNumber()) {
                continue;
            }
            records.add(new DailyAggregateRecord(
                    ticker,
                    decimal(r.path("o")),
                    decimal(r.path("h")),
                    decimal(r.path("l")),
                    decimal(r.path("c")),
                    decimal(r.path("v")),
                    r.path("t").asLong()));
        }
        return FetchOutcome.data(records);
    }

    private static BigDecimal decimal(JsonNode node) {
        return node.isNumber() ? node.decimalValue() : null;
    }
}
