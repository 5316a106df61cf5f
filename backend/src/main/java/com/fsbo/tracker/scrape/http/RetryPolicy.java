package com.fsbo.tracker.scrape.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;

/**
 * Exponential backoff around a single fetch attempt. Attempt {@code n} (zero based) that
 * fails retryably is followed by a sleep of {@code backoffFactor^n} seconds; a
 * non-retryable failure propagates at once. Holds no state between calls.
 */
public class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    public static final Set<Integer> DEFAULT_RETRYABLE_STATUS_CODES = Set.of(408, 429, 500, 502, 503, 504);
    public static final Sleeper THREAD_SLEEPER = duration -> {
        long ms = Math.max(0, duration.toMillis());
        if (ms > 0) {
            Thread.sleep(ms);
        }
    };

    private final int maxRetries;
    private final double backoffFactor;
    private final Set<Integer> retryableStatusCodes;
    private final Sleeper sleeper;

    public RetryPolicy(int maxRetries, double backoffFactor, Set<Integer> retryableStatusCodes, Sleeper sleeper) {
        this.maxRetries = Math.max(0, maxRetries);
        this.backoffFactor = backoffFactor;
        this.retryableStatusCodes = Set.copyOf(retryableStatusCodes);
        this.sleeper = sleeper;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, 2.0, DEFAULT_RETRYABLE_STATUS_CODES, THREAD_SLEEPER);
    }

    public <T> T execute(String label, FetchOperation<T> operation) throws FetchException {
        FetchException lastFailure = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                return operation.attempt();
            } catch (FetchException e) {
                lastFailure = e;
                if (!e.isRetryable(retryableStatusCodes)) {
                    throw e;
                }
                if (attempt >= maxRetries) {
                    log.warn("{} failed after {} attempts: {}", label, maxRetries + 1, e.getMessage());
                    break;
                }
                Duration backoff = backoffFor(attempt);
                log.warn(
                    "{} failed (attempt {}/{}), retrying in {} ms: {}",
                    label,
                    attempt + 1,
                    maxRetries + 1,
                    backoff.toMillis(),
                    e.getMessage()
                );
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        throw lastFailure;
    }

    public Duration backoffFor(int attempt) {
        double seconds = Math.pow(backoffFactor, attempt);
        return Duration.ofMillis(Math.round(seconds * 1000));
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public double getBackoffFactor() {
        return backoffFactor;
    }

    public Set<Integer> getRetryableStatusCodes() {
        return retryableStatusCodes;
    }

    @FunctionalInterface
    public interface FetchOperation<T> {
        T attempt() throws FetchException;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }
}
