package com.propertyintel.ingest.extract;

import com.propertyintel.ingest.config.IngestProperties;
import com.propertyintel.ingest.exception.ExtractionException;
import com.propertyintel.ingest.exception.RateLimitExceededException;
import com.propertyintel.ingest.model.SourceType;
import com.propertyintel.ingest.model.UnifiedRecord;
import com.propertyintel.ingest.service.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Items of an RSS or Atom feed.
 *
 * Feeds list newest first, so the checkpoint holds the newest guid seen and the
 * next run stops as soon as it meets that guid again. Guids are not ordered, so
 * the driver's id comparison is switched off for this source.
 */
@Component
@Slf4j
public class FeedExtractor implements SourceExtractor {

    private final SourceHttpClient http;
    private final RateLimiter rateLimiter;
    private final IngestProperties.Feed settings;

    public FeedExtractor(SourceHttpClient http, RateLimiter rateLimiter, IngestProperties properties) {
        this.http = http;
        this.rateLimiter = rateLimiter;
        this.settings = properties.getFeed();
    }

    @Override
    public SourceType sourceType() {
        return SourceType.FEED;
    }

    @Override
    public String sourceRef() {
        return settings.getUrl();
    }

    @Override
    public Stream<Map<String, Object>> extract(ExtractionContext context) {
        List<Element> items = FeedParser.items(FeedParser.parse(fetchFeed()));
        String lastGuid = context.lastSourceId();
        log.info("Feed {} has {} items", settings.getUrl(), items.size());

        return items.stream()
                .map(item -> parseItem(item, context))
                .filter(Objects::nonNull)
                .takeWhile(record -> {
                    if (lastGuid != null && lastGuid.equals(record.get("guid"))) {
                        log.info("Reached last processed item: {}", lastGuid);
                        return false;
                    }
                    return true;
                });
    }

    @Override
    public String sourceId(Map<String, Object> raw) {
        Object guid = raw.get("guid");
        return guid != null ? guid.toString() : Checksums.sha256(raw);
    }

    @Override
    public boolean filtersByCheckpoint() {
        return false;
    }

    /** Newest loaded guid, and only after a complete pass: older items may still be unread. */
    @Override
    public String checkpointCursor(String firstLoadedId, String lastLoadedId, boolean completed) {
        return completed ? firstLoadedId : null;
    }

    @Override
    public UnifiedRecord transform(Map<String, Object> raw) {
        String description = FeedParser.stripMarkup(text(raw.get("description")));
        String content = FeedParser.stripMarkup(text(raw.get("content")));
        if (content.isEmpty()) {
            content = description;
        }
        if (description.length() > settings.getDescriptionMaxLength()) {
            description = description.substring(0, settings.getDescriptionMaxLength());
        }

        List<String> tags = new ArrayList<>();
        Object categories = raw.get("categories");
        if (categories instanceof List<?>) {
            for (Object c : (List<?>) categories) {
                if (c != null) tags.add(c.toString());
            }
        }
        if (tags.isEmpty() && raw.get("category") != null) {
            tags.add(raw.get("category").toString());
        }

        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("guid", raw.get("guid"));
        extra.put("feed_url", settings.getUrl());

        return UnifiedRecord.builder()
                .title(text(raw.get("title")))
                .description(description.isEmpty() ? null : description)
                .content(content.isEmpty() ? null : content)
                .author(text(raw.get("author")))
                .category(tags.isEmpty() ? null : tags.get(0))
                .tags(tags)
                .url(text(raw.get("link")))
                .publishedAt(FeedParser.parseDate(text(raw.get("pubDate"))))
                .extraData(extra)
                .build();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private String fetchFeed() {
        String key = settings.getRateLimitKey();
        rateLimiter.acquire(key);

        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.USER_AGENT, settings.getUserAgent());
        headers.set(HttpHeaders.ACCEPT, "application/rss+xml, application/atom+xml, application/xml, text/xml");

        try {
            ResponseEntity<String> response = http.get(settings.getUrl(), headers);
            rateLimiter.recordSuccess(key);
            String body = response.getBody();
            if (body == null || body.isBlank()) {
                throw new ExtractionException("Feed " + settings.getUrl() + " returned an empty body");
            }
            return body;
        } catch (RestClientException e) {
            log.error("Feed fetch failed: {}", e.getMessage());
            ExtractionException failure = new ExtractionException("Feed fetch failed: " + e.getMessage(), e);
            try {
                rateLimiter.recordFailure(key);
            } catch (RateLimitExceededException exhausted) {
                failure.addSuppressed(exhausted);
            }
            throw failure;
        }
    }

    private static Map<String, Object> parseItem(Element item, ExtractionContext context) {
        try {
            return FeedParser.toRecord(item);
        } catch (RuntimeException e) {
            log.error("Error parsing feed item: {}", e.getMessage());
            context.reportFailed();
            return null;
        }
    }

    private static String text(Object value) {
        return value != null ? value.toString() : null;
    }
}
