package com.fsbo.tracker.scrape.http;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimiterTest {

    @Test
    void secondCallWaitsAtLeastMinDelay() throws Exception {
        RateLimiter limiter = new RateLimiter(Duration.ofMillis(100), Duration.ofMillis(100), false);

        long start = System.nanoTime();
        limiter.acquire();
        limiter.acquire();
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertThat(elapsedMs).isGreaterThanOrEqualTo(95);
    }

    @Test
    void firstCallDoesNotWait() throws Exception {
        RateLimiter limiter = new RateLimiter(Duration.ofSeconds(5), Duration.ofSeconds(5), false);

        long start = System.nanoTime();
        limiter.acquire();

        assertThat(Duration.ofNanos(System.nanoTime() - start).toMillis()).isLessThan(1000);
    }

    @Test
    void maxDelayIsNeverBelowMinDelay() {
        RateLimiter limiter = new RateLimiter(Duration.ofMillis(300), Duration.ofMillis(100), true);
        assertThat(limiter.maxDelay()).isEqualTo(Duration.ofMillis(300));
    }

    @Test
    void jitteredDelaysStayWithinConfiguredBounds() {
        RateLimiter limiter = new RateLimiter(Duration.ofMillis(200), Duration.ofMillis(800), true);

        for (int i = 0; i < 1000; i++) {
            assertThat(limiter.nextDelay()).isBetween(Duration.ofMillis(200), Duration.ofMillis(800));
        }
    }

    @Test
    void withoutJitterDelayIsAlwaysMinDelay() {
        RateLimiter limiter = new RateLimiter(Duration.ofMillis(200), Duration.ofMillis(800), false);

        for (int i = 0; i < 100; i++) {
            assertThat(limiter.nextDelay()).isEqualTo(Duration.ofMillis(200));
        }
    }
}
