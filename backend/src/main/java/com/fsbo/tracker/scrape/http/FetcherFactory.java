package com.fsbo.tracker.scrape.http;

import com.fsbo.tracker.scrape.model.SourceSettings;
import org.springframework.stereotype.Component;

@Component
public class FetcherFactory {
    private final PoliteHttpClient httpClient;
    private final RetryPolicy retryPolicy;

    public FetcherFactory(PoliteHttpClient httpClient, RetryPolicy retryPolicy) {
        this.httpClient = httpClient;
        this.retryPolicy = retryPolicy;
    }

    public Fetcher open(SourceSettings settings) {
        return new HttpFetcher(settings.sourceId(), httpClient, RateLimiter.forSource(settings), retryPolicy);
    }
}
