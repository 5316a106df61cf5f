package com.fsbo.tracker.scrape.model;

/**
 * One unit of work discovered for a source. {@code referenceId} is an optional opaque
 * identifier (for example a listing id parsed out of a search page).
 */
public record FetchTarget(String url, String referenceId) {
    public static FetchTarget of(String url) {
        return new FetchTarget(url, null);
    }
}
