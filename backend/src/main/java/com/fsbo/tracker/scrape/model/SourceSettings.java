package com.fsbo.tracker.scrape.model;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Effective configuration of one source for one run. Empty sets mean unrestricted.
 */
public record SourceSettings(
    String sourceId,
    boolean enabled,
    double minDelaySeconds,
    double maxDelaySeconds,
    boolean jitter,
    int maxListings,
    int maxPages,
    Set<String> allowedStates,
    Set<String> allowlistDomains,
    Set<String> blocklistDomains,
    List<String> startUrls,
    String listingLinkPattern,
    String nextPageSelector
) {
    public Duration minDelay() {
        return Duration.ofMillis(Math.round(minDelaySeconds * 1000));
    }

    public Duration maxDelay() {
        return Duration.ofMillis(Math.round(maxDelaySeconds * 1000));
    }

    public boolean isStateAllowed(String state) {
        return allowedStates.isEmpty() || (state != null && allowedStates.contains(state));
    }
}
