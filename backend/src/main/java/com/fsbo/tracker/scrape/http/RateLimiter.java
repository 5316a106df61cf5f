package com.fsbo.tracker.scrape.http;

import com.fsbo.tracker.scrape.model.SourceSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Minimum spacing between consecutive requests of one source. Each source run owns its
 * own instance; instances are never shared across sources.
 */
public final class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final long minDelayNanos;
    private final long maxDelayNanos;
    private final boolean jitter;
    private long lastRequestNanos;
    private boolean hasLastRequest;

    public RateLimiter(Duration minDelay, Duration maxDelay, boolean jitter) {
        this.minDelayNanos = Math.max(0L, minDelay.toNanos());
        this.maxDelayNanos = Math.max(this.minDelayNanos, maxDelay.toNanos());
        this.jitter = jitter;
    }

    public static RateLimiter forSource(SourceSettings settings) {
        return new RateLimiter(settings.minDelay(), settings.maxDelay(), settings.jitter());
    }

    /**
     * Blocks until the drawn delay has elapsed since the previous call, then records the
     * new request instant.
     */
    public synchronized void acquire() throws InterruptedException {
        long delay = nextDelayNanos();
        if (hasLastRequest) {
            long elapsed = System.nanoTime() - lastRequestNanos;
            long sleepNanos = delay - elapsed;
            if (sleepNanos > 0) {
                log.debug("Rate limiting: sleeping {} ms", sleepNanos / 1_000_000);
                Thread.sleep(sleepNanos / 1_000_000, (int) (sleepNanos % 1_000_000));
            }
        }
        lastRequestNanos = System.nanoTime();
        hasLastRequest = true;
    }

    public Duration minDelay() {
        return Duration.ofNanos(minDelayNanos);
    }

    public Duration maxDelay() {
        return Duration.ofNanos(maxDelayNanos);
    }

    Duration nextDelay() {
        return Duration.ofNanos(nextDelayNanos());
    }

    private long nextDelayNanos() {
        if (!jitter || maxDelayNanos <= minDelayNanos) {
            return minDelayNanos;
        }
        return ThreadLocalRandom.current().nextLong(minDelayNanos, maxDelayNanos + 1);
    }
}
