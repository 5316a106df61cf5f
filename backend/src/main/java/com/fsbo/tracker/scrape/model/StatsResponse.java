package com.fsbo.tracker.scrape.model;

import java.util.List;
import java.util.Map;

public record StatsResponse(
    long totalListings,
    long notExportedListings,
    Map<String, Long> listingsBySource,
    List<ScrapeSession> recentSessions
) {
}
