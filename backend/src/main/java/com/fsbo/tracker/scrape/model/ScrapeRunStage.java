package com.fsbo.tracker.scrape.model;

public enum ScrapeRunStage {
    IDLE,
    DISCOVERING,
    FETCHING_AND_EXTRACTING,
    NORMALIZING,
    PERSISTING,
    COMPLETED,
    FAILED
}
