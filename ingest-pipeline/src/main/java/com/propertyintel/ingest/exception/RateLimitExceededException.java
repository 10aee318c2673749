package com.propertyintel.ingest.exception;

/**
 * Retry budget for a rate-limit key is spent.
 */
public class RateLimitExceededException extends IngestException {

    private final String sourceKey;

    public RateLimitExceededException(String sourceKey, int maxRetries) {
        super("Max retries (" + maxRetries + ") exceeded for " + sourceKey);
        this.sourceKey = sourceKey;
    }

    public String getSourceKey() {
        return sourceKey;
    }
}
