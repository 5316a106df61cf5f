package com.fsbo.tracker.scrape.model;

/**
 * Filter for listing reads. A null {@code exported} means either state; a null
 * {@code limit} means no limit.
 */
public record ListingQuery(String source, Boolean exported, Integer limit, int offset) {
    public static ListingQuery notExported(String source) {
        return new ListingQuery(source, false, null, 0);
    }

    public static ListingQuery exportedOnly(String source) {
        return new ListingQuery(source, true, null, 0);
    }
}
