package com.fsbo.tracker.scrape.model;

import java.util.Set;

public record SourceView(
    String sourceId,
    String displayName,
    boolean enabled,
    double minDelaySeconds,
    double maxDelaySeconds,
    int maxListings,
    int maxPages,
    Set<String> allowedStates
) {
}
