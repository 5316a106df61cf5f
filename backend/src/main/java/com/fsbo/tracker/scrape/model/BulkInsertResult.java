package com.fsbo.tracker.scrape.model;

public record BulkInsertResult(int newCount, int duplicateCount) {
    public static BulkInsertResult empty() {
        return new BulkInsertResult(0, 0);
    }

    public int total() {
        return newCount + duplicateCount;
    }
}
