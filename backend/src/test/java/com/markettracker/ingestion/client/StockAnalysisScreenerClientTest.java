package com.markettracker.ingestion.client;

import com.markettracker.common.RetryPolicy;
import com.markettracker.ingestion.config.SourceProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StockAnalysisScreenerClientTest {

    private static final Instant NOW = Instant.parse("2024-02-01T15:00:00Z");
    private static final String SCREENER_BODY = """
            {"status":200,"data":{"data":[
              {"s":"AAPL","n":"Apple Inc.","price":185.04,"change":-0.5,"industry":"Consumer Electronics",
               "volume":49120300,"peRatio":"28.7","marketCap":2866000000000,"revenue":383290000000},
              {"s":"","n":"blank ticker"},
              {"s":"MSFT","n":"Microsoft","price":"n/a"}
            ]}}""";

    private final List<Duration> backoffs = new ArrayList<>();

    @Test
    @DisplayName("parses screener rows and stamps them with one fetch time")
    void parsesScreenerRows() {
        List<ScreenerRecord> rows = StockAnalysisScreenerClient.parseRows(SCREENER_BODY, NOW,
                StockAnalysisScreenerClient::toScreenerRecord);

        assertThat(rows).extracting(ScreenerRecord::ticker).containsExactly("AAPL", "MSFT");
        ScreenerRecord aapl = rows.get(0);
        assertThat(aapl.companyName()).isEqualTo("Apple Inc.");
        assertThat(aapl.peRatio()).isEqualByComparingTo("28.7");
        assertThat(aapl.marketCap()).isEqualByComparingTo("2866000000000");
        assertThat(rows.get(1).price()).isNull();
        assertThat(rows).extracting(ScreenerRecord::fetchedAt).containsOnly(NOW);
    }

    @Test
    @DisplayName("parses ticker profile columns")
    void parsesTickerProfiles() {
        String body = """
                {"data":{"data":[{"s":"KO","enterpriseValue":297000000000,"marketCapCategory":"Mega-Cap",
                  "sector":"Consumer Staples","exchange":"NYSE","peForward":21.3,"dividendYield":"3.1",
                  "analystRatings":"Buy","priceTarget":66.5}]}}""";

        List<TickerProfileRecord> rows = StockAnalysisScreenerClient.parseRows(body, NOW,
                StockAnalysisScreenerClient::toTickerProfileRecord);

        assertThat(rows).hasSize(1);
        TickerProfileRecord ko = rows.get(0);
        assertThat(ko.marketCapGroup()).isEqualTo("Mega-Cap");
        assertThat(ko.sector()).isEqualTo("Consumer Staples");
        assertThat(ko.dividendYield()).isEqualByComparingTo("3.1");
        assertThat(ko.analystRating()).isEqualTo("Buy");
    }

    @Test
    @DisplayName("a response without data.data list is rejected")
    void unexpectedFormat() {
        assertThatThrownBy(() -> StockAnalysisScreenerClient.parseRows("{\"data\":{}}", NOW,
                StockAnalysisScreenerClient::toScreenerRecord))
                .isInstanceOf(ExternalSourceException.class)
                .hasMessageContaining("data.data");
    }

    @Test
    @DisplayName("HTTP 429 is raised as RateLimitException")
    void rateLimited() {
        StockAnalysisScreenerClient client = client(request -> Mono.just(response(HttpStatus.TOO_MANY_REQUESTS, "")));

        assertThatThrownBy(client::fetchSnapshot).isInstanceOf(RateLimitException.class);
        assertThat(FetchOutcome.capture(client::fetchSnapshot).kind()).isEqualTo(FetchOutcome.Kind.RATE_LIMITED);
    }

    @Test
    @DisplayName("network errors are retried with backoff, then succeed")
    void networkErrorRetried() {
        AtomicInteger calls = new AtomicInteger();
        StockAnalysisScreenerClient client = client(request -> calls.incrementAndGet() == 1
                ? Mono.error(new WebClientRequestException(new IOException("connection reset"),
                        HttpMethod.GET, URI.create("https://example.test"), new HttpHeaders()))
                : Mono.just(response(HttpStatus.OK, SCREENER_BODY)));

        List<ScreenerRecord> rows = client.fetchSnapshot();

        assertThat(rows).hasSize(2);
        assertThat(calls.get()).isEqualTo(2);
        assertThat(backoffs).containsExactly(Duration.ofMillis(10));
    }

    @Test
    @DisplayName("network errors on every attempt become a hard error")
    void networkErrorExhausted() {
        StockAnalysisScreenerClient client = client(request -> Mono.error(new WebClientRequestException(
                new IOException("down"), HttpMethod.GET, URI.create("https://example.test"), new HttpHeaders())));

        FetchOutcome<ScreenerRecord> outcome = FetchOutcome.capture(client::fetchSnapshot);

        assertThat(outcome.kind()).isEqualTo(FetchOutcome.Kind.HARD_ERROR);
        assertThat(backoffs).hasSize(2);
    }

    private StockAnalysisScreenerClient client(ExchangeFunction exchange) {
        RateLimiter limiter = RateLimiter.of("test", RateLimiterConfig.custom()
                .limitForPeriod(100)
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .timeoutDuration(Duration.ZERO)
                .build());
        return new StockAnalysisScreenerClient(new SourceProperties(), WebClient.builder().exchangeFunction(exchange),
                limiter, RetryPolicy.fixed(10, 3), backoffs::add, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static ClientResponse response(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }
}
