package com.fsbo.tracker.scrape.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ScrapeStatus {
    COMPLETED("completed"),
    FAILED("failed");

    private final String dbValue;

    ScrapeStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    @JsonValue
    public String dbValue() {
        return dbValue;
    }

    public static ScrapeStatus fromDbValue(String value) {
        if (value == null) {
            return FAILED;
        }
        return "completed".equals(value.trim().toLowerCase(Locale.ROOT)) ? COMPLETED : FAILED;
    }
}
