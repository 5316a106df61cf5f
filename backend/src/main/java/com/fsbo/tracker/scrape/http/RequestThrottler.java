package com.fsbo.tracker.scrape.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sliding one-minute request cap per domain, shared by every source in the process.
 * Sits in front of the per-source {@link RateLimiter}, not in place of it.
 */
public class RequestThrottler {
    private static final Logger log = LoggerFactory.getLogger(RequestThrottler.class);
    private static final Duration WINDOW = Duration.ofSeconds(60);

    private final int maxRequestsPerMinute;
    private final Clock clock;
    private final Map<String, Deque<Instant>> requestTimes = new ConcurrentHashMap<>();

    public RequestThrottler(int maxRequestsPerMinute, Clock clock) {
        this.maxRequestsPerMinute = Math.max(1, maxRequestsPerMinute);
        this.clock = clock;
    }

    public boolean shouldThrottle(String domain) {
        Deque<Instant> times = timesFor(domain);
        synchronized (times) {
            evictExpired(times);
            return times.size() >= maxRequestsPerMinute;
        }
    }

    public void recordRequest(String domain) {
        Deque<Instant> times = timesFor(domain);
        synchronized (times) {
            times.addLast(clock.instant());
        }
    }

    /**
     * Time until the oldest request in the window expires, or zero while under the cap.
     */
    public Duration getWaitTime(String domain) {
        Deque<Instant> times = timesFor(domain);
        synchronized (times) {
            evictExpired(times);
            if (times.size() < maxRequestsPerMinute || times.isEmpty()) {
                return Duration.ZERO;
            }
            Duration wait = Duration.between(clock.instant(), times.peekFirst().plus(WINDOW));
            return wait.isNegative() ? Duration.ZERO : wait;
        }
    }

    /**
     * Sleeps while the domain is over its cap, then records the request.
     */
    public void acquire(String domain) throws InterruptedException {
        while (shouldThrottle(domain)) {
            Duration wait = getWaitTime(domain);
            log.info("Throttling {}: {} requests in the last minute, waiting {} ms", normalize(domain), maxRequestsPerMinute, wait.toMillis());
            Thread.sleep(Math.max(1L, wait.toMillis()));
        }
        recordRequest(domain);
    }

    public int getMaxRequestsPerMinute() {
        return maxRequestsPerMinute;
    }

    private Deque<Instant> timesFor(String domain) {
        return requestTimes.computeIfAbsent(normalize(domain), ignored -> new ArrayDeque<>());
    }

    private void evictExpired(Deque<Instant> times) {
        Instant cutoff = clock.instant().minus(WINDOW);
        while (!times.isEmpty() && !times.peekFirst().isAfter(cutoff)) {
            times.pollFirst();
        }
    }

    private String normalize(String domain) {
        return domain == null ? "" : domain.trim().toLowerCase(Locale.ROOT);
    }
}
