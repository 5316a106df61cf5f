package com.fsbo.tracker.scrape.extract;

import com.fsbo.tracker.scrape.http.Fetcher;
import com.fsbo.tracker.scrape.model.FetchTarget;
import com.fsbo.tracker.scrape.model.RawListingCandidate;
import com.fsbo.tracker.scrape.model.SourceSettings;

import java.util.List;

/**
 * Discovery and parsing for one listing source. Implementations are Spring beans and are
 * looked up by {@link #sourceId()} in the {@link ExtractorRegistry}.
 */
public interface SourceExtractor {

    String sourceId();

    String displayName();

    /**
     * Returns the targets to fetch for this run. Any network work done here goes through
     * {@code fetcher} and must stop at {@link SourceSettings#maxPages()}.
     */
    List<FetchTarget> discover(SourceSettings settings, Fetcher fetcher) throws DiscoveryException;

    /**
     * Parses one fetched page. Candidate fields are best effort and may be blank.
     */
    List<RawListingCandidate> extract(SourceSettings settings, FetchTarget target, String content)
        throws ExtractionException;
}
