package com.fsbo.tracker.scrape.http;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RetryPolicyTest {
    private final List<Duration> sleeps = new ArrayList<>();
    private final RetryPolicy policy = new RetryPolicy(
        3,
        2.0,
        RetryPolicy.DEFAULT_RETRYABLE_STATUS_CODES,
        sleeps::add
    );

    @Test
    void retriesRetryableStatusWithExponentialBackoff() throws Exception {
        AtomicInteger attempts = new AtomicInteger();

        String result = policy.execute("test", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new FetchException("https://example.com", 503, FetchException.HTTP_STATUS, "HTTP 503");
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, attempts.get());
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    @Test
    void nonRetryableStatusPropagatesImmediately() {
        AtomicInteger attempts = new AtomicInteger();

        FetchException thrown = assertThrows(FetchException.class, () -> policy.execute("test", () -> {
            attempts.incrementAndGet();
            throw new FetchException("https://example.com", 404, FetchException.HTTP_STATUS, "HTTP 404");
        }));

        assertEquals(404, thrown.getStatusCode());
        assertEquals(1, attempts.get());
        assertThat(sleeps).isEmpty();
    }

    @Test
    void exhaustedRetriesRethrowLastFailure() {
        AtomicInteger attempts = new AtomicInteger();

        FetchException thrown = assertThrows(FetchException.class, () -> policy.execute("test", () -> {
            int attempt = attempts.incrementAndGet();
            throw new FetchException("https://example.com", FetchException.TIMEOUT, "timeout " + attempt, null);
        }));

        assertEquals(4, attempts.get());
        assertEquals("timeout 4", thrown.getMessage());
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4));
    }

    @Test
    void invalidUrlIsNeverRetried() {
        FetchException invalid = new FetchException("bad", 0, FetchException.INVALID_URL, "bad url");
        assertThat(invalid.isRetryable(RetryPolicy.DEFAULT_RETRYABLE_STATUS_CODES)).isFalse();
        FetchException io = new FetchException("x", FetchException.IO_ERROR, "reset", null);
        assertThat(io.isRetryable(RetryPolicy.DEFAULT_RETRYABLE_STATUS_CODES)).isTrue();
    }
}
