package com.propertyintel.ingest.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyintel.ingest.config.IngestProperties;
import com.propertyintel.ingest.exception.AuthenticationException;
import com.propertyintel.ingest.exception.ExtractionException;
import com.propertyintel.ingest.exception.RateLimitExceededException;
import com.propertyintel.ingest.model.SourceType;
import com.propertyintel.ingest.model.UnifiedRecord;
import com.propertyintel.ingest.service.RateLimiter;
import com.propertyintel.ingest.service.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Market data from the CoinPaprika REST API.
 *
 * The coin list is fetched up front; each active coin then costs one ticker call
 * as the stream is pulled. Every call goes through the shared rate limiter. A 401
 * ends the run, a 429 is waited out (the longer of Retry-After and the limiter's
 * backoff) and retried until the limiter gives up.
 *
 * Source ids lead with the UTC date ({@code coinpaprika:2024-01-15:bitcoin}), so
 * several runs on one day update the same rows and each day adds a new snapshot.
 * Coins come in rank order, not id order, so the id cursor is stored but never
 * used to drop records.
 */
@Component
@Slf4j
public class PaginatedApiExtractor implements SourceExtractor {

    private static final double DEFAULT_RETRY_AFTER_SECONDS = 60.0;

    private final SourceHttpClient http;
    private final RateLimiter rateLimiter;
    private final Sleeper sleeper;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final IngestProperties.Api settings;

    public PaginatedApiExtractor(SourceHttpClient http,
                                 RateLimiter rateLimiter,
                                 Sleeper sleeper,
                                 ObjectMapper objectMapper,
                                 Clock clock,
                                 IngestProperties properties) {
        this.http = http;
        this.rateLimiter = rateLimiter;
        this.sleeper = sleeper;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.settings = properties.getApi();
        if (settings.getApiKey() == null || settings.getApiKey().isBlank()) {
            log.info("No API key configured, using the {} free tier", settings.getSourceName());
        }
    }

    @Override
    public SourceType sourceType() {
        return SourceType.API;
    }

    @Override
    public String sourceRef() {
        return settings.getBaseUrl() + settings.getListPath();
    }

    @Override
    public Stream<Map<String, Object>> extract(ExtractionContext context) {
        List<Map<String, Object>> coins = fetchActiveCoins();
        log.info("Fetching ticker data for {} active coins", coins.size());
        return coins.stream()
                .map(this::fetchWithTicker)
                .filter(Objects::nonNull);
    }

    @Override
    public String sourceId(Map<String, Object> raw) {
        Object id = raw.get("id");
        return settings.getSourceName() + ":" + LocalDate.now(clock) + ":" + (id != null ? id : "");
    }

    @Override
    public boolean filtersByCheckpoint() {
        return false;
    }

    @Override
    public UnifiedRecord transform(Map<String, Object> raw) {
        Map<String, Object> usd = usdQuote(raw);

        double price = number(usd.get("price"));
        double marketCap = number(usd.get("market_cap"));
        double volume24h = number(usd.get("volume_24h"));
        double change24h = number(usd.get("percent_change_24h"));

        String description = String.format(Locale.US,
                "Current Price: $%,.6f | 24h Change: %+.2f%% | Market Cap: $%,.0f | 24h Volume: $%,.0f",
                price, change24h, marketCap, volume24h);

        List<String> tags = new ArrayList<>();
        Object rank = raw.get("rank");
        if (rank != null && number(rank) != 0) {
            tags.add("rank-" + rank);
        }
        if (change24h > 0) {
            tags.add("bullish");
        } else if (change24h < 0) {
            tags.add("bearish");
        }
        if (Boolean.TRUE.equals(raw.get("is_new"))) {
            tags.add("new-listing");
        }

        Object name = raw.get("name");
        Object symbol = raw.get("symbol");
        Object id = raw.get("id");

        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("coin_id", id);
        extra.put("symbol", symbol);
        extra.put("rank", rank);
        extra.put("current_price", price);
        extra.put("market_cap", marketCap);
        extra.put("volume_24h", volume24h);
        extra.put("percent_change_1h", usd.get("percent_change_1h"));
        extra.put("percent_change_24h", change24h);
        extra.put("percent_change_7d", number(usd.get("percent_change_7d")));
        extra.put("percent_change_30d", number(usd.get("percent_change_30d")));
        extra.put("circulating_supply", raw.get("circulating_supply"));
        extra.put("total_supply", raw.get("total_supply"));
        extra.put("max_supply", raw.get("max_supply"));
        extra.put("ath_price", usd.get("ath_price"));
        extra.put("ath_date", usd.get("ath_date"));
        extra.put("is_active", raw.get("is_active"));
        extra.put("is_new", raw.get("is_new"));

        return UnifiedRecord.builder()
                .title((name != null ? name : "Unknown") + " ("
                        + (symbol != null ? symbol.toString().toUpperCase(Locale.ROOT) : "") + ")")
                .description(description)
                .content(toJson(raw))
                .author("CoinPaprika")
                .category("cryptocurrency")
                .tags(tags)
                .url("https://coinpaprika.com/coin/" + (id != null ? id : ""))
                .publishedAt(lastUpdated(raw.get("last_updated")))
                .extraData(extra)
                .build();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<Map<String, Object>> fetchActiveCoins() {
        Object body = request(settings.getBaseUrl() + settings.getListPath());
        if (!(body instanceof List<?>)) {
            log.error("Unexpected response format from {}: expected a list", settings.getSourceName());
            return List.of();
        }
        List<Map<String, Object>> active = new ArrayList<>();
        for (Object entry : (List<?>) body) {
            if (active.size() >= settings.getMaxEntries()) break;
            if (!(entry instanceof Map<?, ?>)) continue;
            Map<String, Object> coin = asMap(entry);
            if (Boolean.TRUE.equals(coin.get("is_active")) && coin.get("id") != null) {
                active.add(coin);
            }
        }
        return active;
    }

    /** Coin merged with its ticker, or null when the ticker could not be fetched. */
    private Map<String, Object> fetchWithTicker(Map<String, Object> coin) {
        String coinId = String.valueOf(coin.get("id"));
        String url = UriComponentsBuilder.fromHttpUrl(settings.getBaseUrl() + settings.getDetailPath())
                .buildAndExpand(coinId)
                .toUriString();
        try {
            Object ticker = request(url);
            if (!(ticker instanceof Map<?, ?>)) {
                log.warn("Empty ticker for {}", coinId);
                return null;
            }
            Map<String, Object> merged = new LinkedHashMap<>(coin);
            merged.putAll(asMap(ticker));
            merged.put("_fetched_at", LocalDateTime.now(clock).toString());
            merged.put("_source", settings.getSourceName());
            return merged;
        } catch (AuthenticationException | RateLimitExceededException e) {
            throw e;
        } catch (ExtractionException e) {
            log.warn("Failed to get ticker for {}: {}", coinId, e.getMessage());
            return null;
        }
    }

    private Object request(String url) {
        String key = settings.getRateLimitKey();
        while (true) {
            rateLimiter.acquire(key);
            try {
                ResponseEntity<String> response = http.get(url, headers());
                rateLimiter.recordSuccess(key);
                return parse(response.getBody(), url);

            } catch (HttpClientErrorException.Unauthorized e) {
                throw new AuthenticationException("API authentication failed for " + url);

            } catch (HttpClientErrorException.TooManyRequests e) {
                double retryAfter = retryAfterSeconds(e.getResponseHeaders());
                double backoff = rateLimiter.recordFailure(key);
                double wait = Math.max(backoff, retryAfter);
                log.warn("Rate limited by {}, sleeping {}s", settings.getSourceName(), String.format("%.1f", wait));
                sleeper.sleep(Sleeper.ofSeconds(wait));

            } catch (RestClientException e) {
                log.error("API request failed: {}", e.getMessage());
                throw new ExtractionException("API request failed: " + e.getMessage(), e);
            }
        }
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (settings.getApiKey() != null && !settings.getApiKey().isBlank()) {
            headers.setBearerAuth(settings.getApiKey());
        }
        return headers;
    }

    private Object parse(String body, String url) {
        if (body == null || body.isBlank()) return null;
        try {
            return objectMapper.readValue(body, Object.class);
        } catch (JsonProcessingException e) {
            throw new ExtractionException("Malformed JSON from " + url + ": " + e.getOriginalMessage(), e);
        }
    }

    private static double retryAfterSeconds(HttpHeaders headers) {
        String value = headers != null ? headers.getFirst(HttpHeaders.RETRY_AFTER) : null;
        if (value == null) return DEFAULT_RETRY_AFTER_SECONDS;
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            log.debug("Non-numeric Retry-After '{}', using {}s", value, DEFAULT_RETRY_AFTER_SECONDS);
            return DEFAULT_RETRY_AFTER_SECONDS;
        }
    }

    private LocalDateTime lastUpdated(Object value) {
        if (value != null) {
            try {
                return OffsetDateTime.parse(value.toString()).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
            } catch (DateTimeParseException e) {
                log.debug("Unparseable last_updated '{}'", value);
            }
        }
        return LocalDateTime.now(clock);
    }

    private String toJson(Map<String, Object> raw) {
        try {
            return objectMapper.writeValueAsString(raw);
        } catch (JsonProcessingException e) {
            return String.valueOf(raw);
        }
    }

    private static Map<String, Object> usdQuote(Map<String, Object> raw) {
        Object quotes = raw.get("quotes");
        if (quotes instanceof Map<?, ?>) {
            Object usd = ((Map<?, ?>) quotes).get("USD");
            if (usd instanceof Map<?, ?>) {
                return asMap(usd);
            }
        }
        return Map.of();
    }

    private static double number(Object value) {
        return value instanceof Number ? ((Number) value).doubleValue() : 0.0;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }
}
