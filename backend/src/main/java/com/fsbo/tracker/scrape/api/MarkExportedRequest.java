package com.fsbo.tracker.scrape.api;

import java.util.List;

public record MarkExportedRequest(List<Long> ids) {
}
