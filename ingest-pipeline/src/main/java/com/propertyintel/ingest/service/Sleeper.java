package com.propertyintel.ingest.service;

import com.propertyintel.ingest.exception.ExtractionException;

import java.time.Duration;

/**
 * Blocking pause used for rate-limit waits and backoff. Swapped out in tests.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration);

    static Sleeper threadSleep() {
        return duration -> {
            try {
                Thread.sleep(duration.toMillis());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new ExtractionException("Interrupted while waiting " + duration, ie);
            }
        };
    }

    static Duration ofSeconds(double seconds) {
        return Duration.ofMillis((long) Math.ceil(seconds * 1000));
    }
}
