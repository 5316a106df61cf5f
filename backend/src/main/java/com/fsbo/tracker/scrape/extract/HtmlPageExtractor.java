package com.fsbo.tracker.scrape.extract;

import com.fsbo.tracker.scrape.model.FetchTarget;
import com.fsbo.tracker.scrape.model.RawListingCandidate;
import com.fsbo.tracker.scrape.model.SourceSettings;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Page parsing shared by the HTML sources: strategy chain, page URL as the fallback
 * listing URL, per-page de-duplication, and the {@code maxListings} cap.
 */
public abstract class HtmlPageExtractor implements SourceExtractor {
    private final AddressStrategyChain strategyChain;

    protected HtmlPageExtractor(AddressStrategyChain strategyChain) {
        this.strategyChain = strategyChain;
    }

    @Override
    public List<RawListingCandidate> extract(SourceSettings settings, FetchTarget target, String content)
        throws ExtractionException {
        List<RawListingCandidate> candidates = strategyChain.extract(content, target.url());
        List<RawListingCandidate> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (RawListingCandidate candidate : candidates) {
            if (out.size() >= settings.maxListings()) {
                break;
            }
            if (!seen.add(pageKey(candidate))) {
                continue;
            }
            if (candidate.listingUrl() == null || candidate.listingUrl().isBlank()) {
                candidate = candidate.withListingUrl(target.url());
            }
            out.add(candidate);
        }
        return out;
    }

    private String pageKey(RawListingCandidate candidate) {
        return String.join(
            "|",
            lower(candidate.street()),
            lower(candidate.city()),
            lower(candidate.state()),
            lower(candidate.zipCode())
        );
    }

    private String lower(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
