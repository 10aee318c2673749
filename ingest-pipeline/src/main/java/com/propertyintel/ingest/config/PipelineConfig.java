package com.propertyintel.ingest.config;

import com.propertyintel.ingest.service.RateLimiter;
import com.propertyintel.ingest.service.Sleeper;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

/**
 * Shared infrastructure beans. The rate limiter is a single instance so that
 * extractors sharing a key also share its window.
 */
@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleep();
    }

    @Bean
    public RateLimiter rateLimiter(IngestProperties properties, Clock clock, Sleeper sleeper) {
        return new RateLimiter(properties.getRateLimit(), clock, sleeper);
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, IngestProperties properties) {
        return builder
                .setConnectTimeout(properties.getHttp().getConnectTimeout())
                .setReadTimeout(properties.getHttp().getReadTimeout())
                .build();
    }
}
