package com.fsbo.tracker.scrape.model;

public record RawListingCandidate(
    String street,
    String city,
    String state,
    String zipCode,
    String listingUrl,
    String notes
) {
    public RawListingCandidate withListingUrl(String url) {
        return new RawListingCandidate(street, city, state, zipCode, url, notes);
    }
}
