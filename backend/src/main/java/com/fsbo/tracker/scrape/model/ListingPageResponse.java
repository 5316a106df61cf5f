package com.fsbo.tracker.scrape.model;

import java.util.List;

public record ListingPageResponse(
    List<Listing> items,
    long total,
    Integer limit,
    int offset
) {
}
