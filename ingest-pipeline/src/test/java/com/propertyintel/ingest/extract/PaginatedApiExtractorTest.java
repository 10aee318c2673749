package com.propertyintel.ingest.extract;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyintel.ingest.config.IngestProperties;
import com.propertyintel.ingest.exception.AuthenticationException;
import com.propertyintel.ingest.exception.RateLimitExceededException;
import com.propertyintel.ingest.model.UnifiedRecord;
import com.propertyintel.ingest.service.RateLimiter;
import com.propertyintel.ingest.support.MutableClock;
import com.propertyintel.ingest.support.RecordingSleeper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withUnauthorizedRequest;

class PaginatedApiExtractorTest {

    private static final String BASE = "https://api.test/v1";

    private static final String COINS = """
            [
              {"id": "btc-bitcoin", "name": "Bitcoin", "symbol": "BTC", "rank": 1, "is_new": false, "is_active": true},
              {"id": "old-coin", "name": "Old", "symbol": "OLD", "rank": 900, "is_new": false, "is_active": false},
              {"id": "eth-ethereum", "name": "Ethereum", "symbol": "ETH", "rank": 2, "is_new": false, "is_active": true}
            ]
            """;

    private MutableClock clock;
    private RecordingSleeper sleeper;
    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private IngestProperties properties;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-01-15T10:00:00Z");
        sleeper = new RecordingSleeper(clock);
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        properties = new IngestProperties();
        properties.getApi().setBaseUrl(BASE);
    }

    @Test
    void mergesEachActiveCoinWithItsTicker() {
        server.expect(requestTo(BASE + "/coins")).andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(COINS, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/tickers/btc-bitcoin"))
                .andRespond(withSuccess(ticker("btc-bitcoin", 42000.5), MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/tickers/eth-ethereum"))
                .andRespond(withSuccess(ticker("eth-ethereum", 2500.0), MediaType.APPLICATION_JSON));

        PaginatedApiExtractor extractor = extractor(limiter(5));
        List<Map<String, Object>> records = extractAll(extractor);

        server.verify();
        assertThat(records).hasSize(2);
        Map<String, Object> btc = records.get(0);
        assertThat(btc).containsEntry("name", "Bitcoin")
                .containsEntry("_source", "coinpaprika")
                .containsEntry("_fetched_at", "2024-01-15T10:00")
                .containsKey("quotes");
        assertThat(extractor.sourceId(btc)).isEqualTo("coinpaprika:2024-01-15:btc-bitcoin");
        assertThat(extractor.filtersByCheckpoint()).isFalse();

        String lastOfDay = extractor.sourceId(records.get(1));
        clock.advance(Duration.ofDays(1));
        assertThat(extractor.sourceId(btc)).isEqualTo("coinpaprika:2024-01-16:btc-bitcoin")
                .isGreaterThan(lastOfDay);
    }

    @Test
    void listIsCappedAtMaxEntries() {
        properties.getApi().setMaxEntries(1);
        server.expect(requestTo(BASE + "/coins")).andRespond(withSuccess(COINS, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/tickers/btc-bitcoin"))
                .andRespond(withSuccess(ticker("btc-bitcoin", 1.0), MediaType.APPLICATION_JSON));

        assertThat(extractAll(extractor(limiter(5)))).hasSize(1);
        server.verify();
    }

    @Test
    void unauthorizedEndsTheRun() {
        server.expect(requestTo(BASE + "/coins")).andRespond(withUnauthorizedRequest());

        PaginatedApiExtractor extractor = extractor(limiter(5));

        assertThatThrownBy(() -> extractAll(extractor))
                .isInstanceOf(AuthenticationException.class)
                .hasMessageContaining("authentication failed");
    }

    @Test
    void tooManyRequestsWaitsForRetryAfterThenRetries() {
        HttpHeaders retryAfter = new HttpHeaders();
        retryAfter.set(HttpHeaders.RETRY_AFTER, "5");
        server.expect(requestTo(BASE + "/coins")).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS).headers(retryAfter));
        server.expect(requestTo(BASE + "/coins")).andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

        RateLimiter limiter = limiter(5);
        List<Map<String, Object>> records = extractAll(extractor(limiter));

        server.verify();
        assertThat(records).isEmpty();
        assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(5));
        assertThat(limiter.stats("api").retryCount()).isZero();
    }

    @Test
    void backoffWinsOverShortRetryAfter() {
        HttpHeaders retryAfter = new HttpHeaders();
        retryAfter.set(HttpHeaders.RETRY_AFTER, "1");
        server.expect(requestTo(BASE + "/coins")).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS).headers(retryAfter));
        server.expect(requestTo(BASE + "/coins")).andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

        extractAll(extractor(limiter(5)));

        assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(2));
    }

    @Test
    void persistentRateLimitingGivesUp() {
        server.expect(requestTo(BASE + "/coins")).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
        server.expect(requestTo(BASE + "/coins")).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        PaginatedApiExtractor extractor = extractor(limiter(1));

        assertThatThrownBy(() -> extractAll(extractor)).isInstanceOf(RateLimitExceededException.class);
        assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(60));
    }

    @Test
    void failedTickerIsSkipped() {
        server.expect(requestTo(BASE + "/coins")).andRespond(withSuccess(COINS, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/tickers/btc-bitcoin")).andRespond(withServerError());
        server.expect(requestTo(BASE + "/tickers/eth-ethereum"))
                .andRespond(withSuccess(ticker("eth-ethereum", 2500.0), MediaType.APPLICATION_JSON));

        List<Map<String, Object>> records = extractAll(extractor(limiter(5)));

        assertThat(records).extracting(r -> r.get("id")).containsExactly("eth-ethereum");
    }

    @Test
    void transformBuildsSummaryTagsAndExtra() {
        Map<String, Object> usd = new LinkedHashMap<>();
        usd.put("price", 42000.123456789);
        usd.put("market_cap", 800_000_000_000.0);
        usd.put("volume_24h", 20_000_000_000.0);
        usd.put("percent_change_24h", 2.5);
        usd.put("percent_change_7d", -1.0);
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("id", "btc-bitcoin");
        raw.put("name", "Bitcoin");
        raw.put("symbol", "btc");
        raw.put("rank", 1);
        raw.put("is_new", true);
        raw.put("last_updated", "2024-01-15T09:30:00Z");
        raw.put("quotes", Map.of("USD", usd));

        UnifiedRecord unified = extractor(limiter(5)).transform(raw);

        assertThat(unified.getTitle()).isEqualTo("Bitcoin (BTC)");
        assertThat(unified.getDescription()).isEqualTo(
                "Current Price: $42,000.123457 | 24h Change: +2.50% | Market Cap: $800,000,000,000 | 24h Volume: $20,000,000,000");
        assertThat(unified.getTags()).containsExactly("rank-1", "bullish", "new-listing");
        assertThat(unified.getAuthor()).isEqualTo("CoinPaprika");
        assertThat(unified.getCategory()).isEqualTo("cryptocurrency");
        assertThat(unified.getUrl()).isEqualTo("https://coinpaprika.com/coin/btc-bitcoin");
        assertThat(unified.getPublishedAt()).isEqualTo(LocalDateTime.of(2024, 1, 15, 9, 30));
        assertThat(unified.getContent()).contains("\"id\":\"btc-bitcoin\"");
        assertThat(unified.getExtraData())
                .containsEntry("coin_id", "btc-bitcoin")
                .containsEntry("current_price", 42000.123456789)
                .containsEntry("percent_change_7d", -1.0);
    }

    @Test
    void transformToleratesBareRecord() {
        UnifiedRecord unified = extractor(limiter(5)).transform(Map.of());

        assertThat(unified.getTitle()).isEqualTo("Unknown ()");
        assertThat(unified.getTags()).isEmpty();
        assertThat(unified.getPublishedAt()).isEqualTo(LocalDateTime.of(2024, 1, 15, 10, 0));
    }

    private RateLimiter limiter(int maxRetries) {
        return new RateLimiter(60, maxRetries, 2.0, clock, sleeper);
    }

    private PaginatedApiExtractor extractor(RateLimiter limiter) {
        return new PaginatedApiExtractor(new SourceHttpClient(restTemplate), limiter, sleeper,
                new ObjectMapper(), clock, properties);
    }

    private static List<Map<String, Object>> extractAll(PaginatedApiExtractor extractor) {
        try (Stream<Map<String, Object>> stream =
                     extractor.extract(new ExtractionContext("run", null, new RunCounters()))) {
            return stream.collect(Collectors.toList());
        }
    }

    private static String ticker(String id, double price) {
        return """
                {"id": "%s", "circulating_supply": 100, "last_updated": "2024-01-15T09:59:00Z",
                 "quotes": {"USD": {"price": %s, "market_cap": 1000, "volume_24h": 10, "percent_change_24h": 1.5}}}
                """.formatted(id, price);
    }
}
