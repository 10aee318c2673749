package com.propertyintel.ingest.service;

import com.propertyintel.ingest.config.IngestProperties;
import com.propertyintel.ingest.exception.RateLimitExceededException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-key rate limiter: a rolling 60 second request window plus an exponential
 * backoff counter for failed calls.
 *
 * Every key's state is guarded by its own monitor, so two extractors hitting the
 * same upstream share one window without over-admitting. The limiter only sleeps
 * in {@link #waitIfNeeded} and {@link #acquire}; backoff returned from
 * {@link #recordFailure} is the caller's to wait out.
 */
@Slf4j
public class RateLimiter {

    private static final long WINDOW_MILLIS = 60_000L;

    private final int requestsPerMinute;
    private final int maxRetries;
    private final double backoffBase;
    private final Clock clock;
    private final Sleeper sleeper;

    private final ConcurrentMap<String, KeyState> states = new ConcurrentHashMap<>();

    public RateLimiter(IngestProperties.RateLimit settings, Clock clock, Sleeper sleeper) {
        this(settings.getRequestsPerMinute(), settings.getMaxRetries(), settings.getBackoffBase(), clock, sleeper);
    }

    public RateLimiter(int requestsPerMinute, int maxRetries, double backoffBase, Clock clock, Sleeper sleeper) {
        if (requestsPerMinute <= 0) {
            throw new IllegalArgumentException("requestsPerMinute must be positive");
        }
        this.requestsPerMinute = requestsPerMinute;
        this.maxRetries = maxRetries;
        this.backoffBase = backoffBase;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * @return seconds to wait before the next request is allowed, 0 when admitted
     */
    public double checkRateLimit(String sourceKey) {
        KeyState state = state(sourceKey);
        synchronized (state) {
            return waitSeconds(state, clock.millis());
        }
    }

    public void recordRequest(String sourceKey) {
        KeyState state = state(sourceKey);
        synchronized (state) {
            state.requestsMade++;
            state.lastRequestAt = clock.millis();
            log.debug("Rate limiter [{}]: {}/{} requests", sourceKey, state.requestsMade, requestsPerMinute);
        }
    }

    public void recordSuccess(String sourceKey) {
        KeyState state = state(sourceKey);
        synchronized (state) {
            state.retryCount = 0;
            state.currentBackoff = 0.0;
        }
    }

    /**
     * Registers a failed call and returns how long to back off.
     *
     * @throws RateLimitExceededException once the retry count passes max-retries
     */
    public double recordFailure(String sourceKey) {
        KeyState state = state(sourceKey);
        synchronized (state) {
            state.retryCount++;
            if (state.retryCount > maxRetries) {
                throw new RateLimitExceededException(sourceKey, maxRetries);
            }
            state.currentBackoff = Math.pow(backoffBase, state.retryCount);
            log.warn("Rate limiter [{}]: retry {}/{}, backoff {}s",
                    sourceKey, state.retryCount, maxRetries, String.format("%.2f", state.currentBackoff));
            return state.currentBackoff;
        }
    }

    public void waitIfNeeded(String sourceKey) {
        double wait = checkRateLimit(sourceKey);
        if (wait > 0) {
            log.info("Rate limit reached for {}, waiting {}s", sourceKey, String.format("%.2f", wait));
            sleeper.sleep(Sleeper.ofSeconds(wait));
        }
    }

    /**
     * Blocks until the window admits one more request, then counts it.
     * Check and count happen under the key's lock.
     */
    public void acquire(String sourceKey) {
        KeyState state = state(sourceKey);
        while (true) {
            double wait;
            synchronized (state) {
                long now = clock.millis();
                wait = waitSeconds(state, now);
                if (wait <= 0) {
                    state.requestsMade++;
                    state.lastRequestAt = now;
                    return;
                }
            }
            log.info("Rate limit reached for {}, waiting {}s", sourceKey, String.format("%.2f", wait));
            sleeper.sleep(Sleeper.ofSeconds(wait));
        }
    }

    public Stats stats(String sourceKey) {
        KeyState state = state(sourceKey);
        synchronized (state) {
            long remaining = Math.max(0, WINDOW_MILLIS - (clock.millis() - state.windowStart));
            return new Stats(sourceKey, state.requestsMade, requestsPerMinute,
                    state.retryCount, state.currentBackoff, remaining / 1000.0);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private KeyState state(String sourceKey) {
        return states.computeIfAbsent(sourceKey, k -> new KeyState(clock.millis()));
    }

    /** Caller holds the state's monitor. */
    private double waitSeconds(KeyState state, long now) {
        long elapsed = now - state.windowStart;
        if (elapsed >= WINDOW_MILLIS) {
            state.requestsMade = 0;
            state.windowStart = now;
            return 0.0;
        }
        if (state.requestsMade >= requestsPerMinute) {
            return (WINDOW_MILLIS - elapsed) / 1000.0;
        }
        return 0.0;
    }

    private static final class KeyState {
        private int requestsMade;
        private long windowStart;
        private int retryCount;
        private double currentBackoff;
        private long lastRequestAt;

        private KeyState(long windowStart) {
            this.windowStart = windowStart;
        }
    }

    public record Stats(
            String sourceKey,
            int requestsMade,
            int requestsLimit,
            int retryCount,
            double currentBackoff,
            double windowRemainingSeconds) {}
}
