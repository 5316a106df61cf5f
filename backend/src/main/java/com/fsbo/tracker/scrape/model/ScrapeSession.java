package com.fsbo.tracker.scrape.model;

import java.time.Instant;

public record ScrapeSession(
    long id,
    String sourceWebsite,
    Instant scrapeStart,
    Instant scrapeEnd,
    int listingsFound,
    int listingsNew,
    int listingsDuplicates,
    int errors,
    ScrapeStatus status,
    String errorMessage
) {
}
