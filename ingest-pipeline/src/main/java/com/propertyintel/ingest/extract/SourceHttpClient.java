package com.propertyintel.ingest.extract;

import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

/**
 * GET calls shared by the HTTP extractors.
 *
 * Connection resets and timeouts (ResourceAccessException) are retried by
 * Resilience4j before they reach the caller. HTTP status errors are not: 401 and
 * 429 carry meaning the extractors act on, so they come back as
 * {@link org.springframework.web.client.HttpClientErrorException}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SourceHttpClient {

    private final RestTemplate restTemplate;

    @Retry(name = "sourceHttp")
    public ResponseEntity<String> get(String url, HttpHeaders headers) {
        log.debug("GET {}", url);
        return restTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers), String.class);
    }
}
