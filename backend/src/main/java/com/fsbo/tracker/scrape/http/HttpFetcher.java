package com.fsbo.tracker.scrape.http;

import com.fsbo.tracker.scrape.model.FetchTarget;
import com.fsbo.tracker.scrape.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Paces requests with the source's {@link RateLimiter}, wraps each one in the
 * {@link RetryPolicy}, and raises {@link FetchException} for anything but a 2xx body.
 */
public class HttpFetcher implements Fetcher {
    private static final Logger log = LoggerFactory.getLogger(HttpFetcher.class);

    private final String sourceId;
    private final PoliteHttpClient httpClient;
    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private int requestCount;
    private boolean closed;

    public HttpFetcher(String sourceId, PoliteHttpClient httpClient, RateLimiter rateLimiter, RetryPolicy retryPolicy) {
        this.sourceId = sourceId;
        this.httpClient = httpClient;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public String fetch(FetchTarget target) throws FetchException {
        if (closed) {
            throw new IllegalStateException("Fetcher for " + sourceId + " is closed");
        }
        String url = target.url();
        return retryPolicy.execute(sourceId + " GET " + url, () -> fetchOnce(url));
    }

    private String fetchOnce(String url) throws FetchException {
        try {
            rateLimiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(url, FetchException.INTERRUPTED, "Interrupted while rate limiting", e);
        }
        requestCount++;
        HttpFetchResult result = httpClient.get(url);
        if (!result.isSuccessful()) {
            throw FetchException.fromResult(result);
        }
        log.debug("[{}] fetched {} ({} ms)", sourceId, result.finalUrlOrRequested(), result.duration().toMillis());
        return result.body() == null ? "" : result.body();
    }

    public int getRequestCount() {
        return requestCount;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            log.debug("[{}] fetch session closed after {} requests", sourceId, requestCount);
        }
    }
}
