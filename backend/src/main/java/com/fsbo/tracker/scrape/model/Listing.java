package com.fsbo.tracker.scrape.model;

import java.time.Instant;

public record Listing(
    long id,
    String street,
    String city,
    String state,
    String zipCode,
    String listingUrl,
    String sourceWebsite,
    Instant scrapedAt,
    Instant lastUpdated,
    String fingerprint,
    boolean exported,
    String notes
) {
}
