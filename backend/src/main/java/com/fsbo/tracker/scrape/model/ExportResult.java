package com.fsbo.tracker.scrape.model;

import java.nio.file.Path;

public record ExportResult(Path outputPath, int rowCount, boolean written) {
    public static ExportResult skipped(Path outputPath) {
        return new ExportResult(outputPath, 0, false);
    }
}
