package com.fsbo.tracker.scrape.api;

/**
 * {@code outputPath} is resolved inside the configured export directory.
 */
public record ExportRequest(String outputPath, String source, Boolean exportedOnly) {
}
