package com.fsbo.tracker.scrape.extract;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class ExtractorRegistry {
    private final Map<String, SourceExtractor> extractors = new LinkedHashMap<>();

    public ExtractorRegistry(List<SourceExtractor> extractors) {
        for (SourceExtractor extractor : extractors) {
            SourceExtractor previous = this.extractors.put(extractor.sourceId(), extractor);
            if (previous != null) {
                throw new IllegalStateException("Duplicate extractor for source " + extractor.sourceId());
            }
        }
    }

    public Optional<SourceExtractor> find(String sourceId) {
        if (sourceId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(extractors.get(sourceId.trim()));
    }

    public List<String> sourceIds() {
        return new ArrayList<>(extractors.keySet());
    }

    public List<SourceExtractor> all() {
        return new ArrayList<>(extractors.values());
    }
}
