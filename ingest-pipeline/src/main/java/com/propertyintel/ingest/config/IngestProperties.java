package com.propertyintel.ingest.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything tunable about the pipeline, bound from the {@code ingest.*} namespace.
 * Built once at startup and handed to each component through its constructor.
 */
@Component
@ConfigurationProperties(prefix = "ingest")
@Data
public class IngestProperties {

    private RateLimit rateLimit = new RateLimit();
    private Drift drift = new Drift();
    private Api api = new Api();
    private File file = new File();
    private Feed feed = new Feed();
    private Http http = new Http();
    private Orchestrator orchestrator = new Orchestrator();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class RateLimit {
        private int requestsPerMinute = 60;
        private int maxRetries = 5;
        private double backoffBase = 2.0;
    }

    @Data
    public static class Drift {
        private boolean enabled = true;
        private double confidenceThreshold = 0.8;

        /** Pairs of type tags that never count as a type change, written "a:b". */
        private List<String> compatibleTypes = new ArrayList<>(List.of(
                "int:float", "str:int", "str:float", "datetime:str", "list:str"));

        /** Per source type (api, file, feed) field → type tag. Replaces the built-in schema for that type. */
        private Map<String, Map<String, String>> expectedSchemas = new LinkedHashMap<>();
    }

    @Data
    public static class Api {
        private boolean enabled = true;
        private String baseUrl = "https://api.coinpaprika.com/v1";
        private String listPath = "/coins";
        private String detailPath = "/tickers/{id}";
        private String apiKey = "";
        private int maxEntries = 100;
        private String sourceName = "coinpaprika";
        private String rateLimitKey = "api";
    }

    @Data
    public static class File {
        private boolean enabled = true;
        private String path = "/app/data/source.csv";

        /** Several files read in order as one source. Takes precedence over path when set. */
        private List<String> paths = new ArrayList<>();
        private List<String> encodings = new ArrayList<>(List.of("UTF-8", "ISO-8859-1", "windows-1252"));
        private int sampleSize = 4096;
        private String rateLimitKey = "file";
    }

    @Data
    public static class Feed {
        private boolean enabled = true;
        private String url = "https://cointelegraph.com/rss";
        private int descriptionMaxLength = 500;
        private String userAgent = "PropertyIntel Ingest/1.0";
        private String rateLimitKey = "feed";
    }

    @Data
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Orchestrator {
        private boolean parallel = false;
        private boolean failOnError = false;
        private int maxWorkers = 3;
    }

    @Data
    public static class Scheduling {
        private String cron = "0 */5 * * * *";
        private boolean runOnStartup = false;
    }
}
