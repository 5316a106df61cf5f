package com.fsbo.tracker.scrape.extract;

import com.fsbo.tracker.scrape.model.RawListingCandidate;
import org.jsoup.nodes.Document;

import java.util.List;

/**
 * One way of pulling address candidates out of a parsed page. Strategies run in
 * {@link #order()} and must not modify the document.
 */
public interface AddressExtractionStrategy {

    String name();

    int order();

    List<RawListingCandidate> extract(Document document, String pageUrl);
}
