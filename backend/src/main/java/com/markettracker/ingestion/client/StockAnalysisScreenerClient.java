package com.markettracker.ingestion.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.markettracker.common.RetryPolicy;
import com.markettracker.common.Sleeper;
import com.markettracker.ingestion.config.SourceProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Screener scrape endpoint. Rows are under data.data[]. Throttled by the local {@code screenerRateLimiter};
 * network errors are retried with capped exponential backoff, HTTP 429 is surfaced as {@link RateLimitException}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StockAnalysisScreenerClient implements ScreenerClient {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SourceProperties sourceProperties;
    private final WebClient.Builder webClientBuilder;
    @Qualifier("screenerRateLimiter")
    private final RateLimiter screenerRateLimiter;
    @Qualifier("screenerRetryPolicy")
    private final RetryPolicy screenerRetryPolicy;
    private final Sleeper sleeper;
    private final Clock clock;

    @Override
    public List<ScreenerRecord> fetchSnapshot() {
        String body = get(sourceProperties.getStockAnalysis().getScreenerUrl(), "screener");
        return parseRows(body, clock.instant(), StockAnalysisScreenerClient::toScreenerRecord);
    }

    @Override
    public List<TickerProfileRecord> fetchTickerProfiles() {
        String body = get(sourceProperties.getStockAnalysis().getTickerProfileUrl(), "ticker profiles");
        return parseRows(body, clock.instant(), StockAnalysisScreenerClient::toTickerProfileRecord);
    }

    private String get(String url, String what) {
        SourceProperties.StockAnalysis props = sourceProperties.getStockAnalysis();
        int maxAttempts = screenerRetryPolicy.getMaxAttempts();
        for (int attempt = 0; ; attempt++) {
            acquirePermit(what);
            try {
                return webClientBuilder.build().get()
                        .uri(url)
                        .header(HttpHeaders.USER_AGENT, props.getUserAgent())
                        .accept(MediaType.APPLICATION_JSON)
                        .retrieve()
                        .bodyToMono(String.class)
                        .block();
            } catch (WebClientResponseException e) {
                if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                    log.warn("Screener rate limit hit fetching {}", what);
                    throw new RateLimitException("HTTP 429 fetching " + what, e);
                }
                throw new ExternalSourceException("HTTP " + e.getStatusCode().value() + " fetching " + what, e);
            } catch (WebClientRequestException e) {
                if (attempt + 1 >= maxAttempts) {
                    throw new ExternalSourceException("Request failed fetching " + what + " after " + maxAttempts + " attempts", e);
                }
                long delayMs = screenerRetryPolicy.delayMs(attempt);
                log.warn("Request error fetching {} (attempt {}/{}), backing off {} ms: {}",
                        what, attempt + 1, maxAttempts, delayMs, e.getMessage());
                pause(delayMs);
            }
        }
    }

    private void acquirePermit(String what) {
        long acquireStart = System.nanoTime();
        boolean permitted = screenerRateLimiter.acquirePermission();
        long waitedMs = (System.nanoTime() - acquireStart) / 1_000_000L;
        if (!permitted) {
            throw new RateLimitException("Local limiter timeout before fetching " + what);
        }
        if (waitedMs >= Math.max(1L, sourceProperties.getStockAnalysis().getLocalLimiterLogThresholdMs())) {
            log.info("Local screener limiter delayed {} ms before fetching {}", waitedMs, what);
        }
    }

    private void pause(long delayMs) {
        try {
            sleeper.sleep(Duration.ofMillis(delayMs));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ExternalSourceException("Interrupted during backoff", ie);
        }
    }

    static <T> List<T> parseRows(String json, Instant fetchedAt, BiFunction<JsonNode, Instant, T> mapper) {
        JsonNode rows;
        try {
            rows = MAPPER.readTree(json == null ? "" : json).path("data").path("data");
        } catch (Exception e) {
            throw new ExternalSourceException("Unparseable screener response", e);
        }
        if (!rows.isArray()) {
            throw new ExternalSourceException("Unexpected screener format: data.data is not a list");
        }
        List<T> out = new ArrayList<>(rows.size());
        for (JsonNode row : rows) {
            String ticker = row.path("s").asText("");
            if (!ticker.isBlank()) {
                out.add(mapper.apply(row, fetchedAt));
            }
        }
        return out;
    }

    static ScreenerRecord toScreenerRecord(JsonNode row, Instant fetchedAt) {
        return new ScreenerRecord(
                row.path("s").asText(),
                row.path("n").asText(""),
                decimal(row.path("price")),
                decimal(row.path("change")),
                row.path("industry").asText(""),
                decimal(row.path("volume")),
                decimal(row.path("peRatio")),
                decimal(row.path("marketCap")),
                decimal(row.path("revenue")),
                fetchedAt);
    }

    static TickerProfileRecord toTickerProfileRecord(JsonNode row, Instant fetchedAt) {
        return new TickerProfileRecord(
                row.path("s").asText(),
                decimal(row.path("enterpriseValue")),
                text(row.path("marketCapCategory")),
                text(row.path("sector")),
                text(row.path("exchange")),
                decimal(row.path("peForward")),
                decimal(row.path("dividendYield")),
                text(row.path("analystRatings")),
                decimal(row.path("priceTarget")),
                fetchedAt);
    }

    private static BigDecimal decimal(JsonNode node) {
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            try {
                return new BigDecimal(node.asText().strip());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String text(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }
}
