package com.fsbo.tracker.scrape.model;

import java.time.Instant;

public record ScrapeRunSummary(
    long sessionId,
    String sourceId,
    Instant startedAt,
    Instant finishedAt,
    int targetsDiscovered,
    int listingsFound,
    int listingsNew,
    int listingsDuplicates,
    int errors,
    ScrapeStatus status,
    ScrapeRunStage finalStage,
    String errorMessage
) {
}
