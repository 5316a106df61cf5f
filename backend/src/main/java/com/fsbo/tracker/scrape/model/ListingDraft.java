package com.fsbo.tracker.scrape.model;

import com.fsbo.tracker.scrape.address.NormalizedAddress;

public record ListingDraft(
    NormalizedAddress address,
    String listingUrl,
    String sourceWebsite,
    String notes
) {
}
