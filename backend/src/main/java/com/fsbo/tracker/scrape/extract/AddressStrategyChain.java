package com.fsbo.tracker.scrape.extract;

import com.fsbo.tracker.scrape.model.RawListingCandidate;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs the address strategies in priority order; the first one that yields candidates
 * wins. A strategy that throws is logged and skipped.
 */
@Component
public class AddressStrategyChain {
    private static final Logger log = LoggerFactory.getLogger(AddressStrategyChain.class);

    private final List<AddressExtractionStrategy> strategies;

    public AddressStrategyChain(List<AddressExtractionStrategy> strategies) {
        List<AddressExtractionStrategy> ordered = new ArrayList<>(strategies);
        ordered.sort(Comparator.comparingInt(AddressExtractionStrategy::order));
        this.strategies = List.copyOf(ordered);
    }

    public List<RawListingCandidate> extract(String html, String pageUrl) throws ExtractionException {
        if (html == null) {
            throw new ExtractionException("No content for " + pageUrl);
        }
        Document document;
        try {
            document = Jsoup.parse(html, pageUrl == null ? "" : pageUrl);
        } catch (RuntimeException e) {
            throw new ExtractionException("Unparseable HTML from " + pageUrl, e);
        }

        RuntimeException firstFailure = null;
        int failures = 0;
        for (AddressExtractionStrategy strategy : strategies) {
            try {
                List<RawListingCandidate> candidates = strategy.extract(document, pageUrl);
                if (!candidates.isEmpty()) {
                    log.debug("{} yielded {} candidates on {}", strategy.name(), candidates.size(), pageUrl);
                    return candidates;
                }
            } catch (RuntimeException e) {
                failures++;
                if (firstFailure == null) {
                    firstFailure = e;
                }
                log.warn("Address strategy {} failed on {}: {}", strategy.name(), pageUrl, e.getMessage());
            }
        }
        if (failures > 0 && failures == strategies.size()) {
            throw new ExtractionException("Every address strategy failed on " + pageUrl, firstFailure);
        }
        return List.of();
    }

    public List<String> strategyNames() {
        return strategies.stream().map(AddressExtractionStrategy::name).toList();
    }
}
