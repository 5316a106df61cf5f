package com.fsbo.tracker.scrape.extract;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fsbo.tracker.config.ScraperProperties;
import com.fsbo.tracker.scrape.model.FetchTarget;
import com.fsbo.tracker.scrape.model.SourceSettings;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PaginatedSearchExtractorTest {
    private static final String START = "https://search.example.com/fsbo?page=1";

    private final PaginatedSearchExtractor extractor = new PaginatedSearchExtractor(new AddressStrategyChain(List.of(
        new JsonLdAddressStrategy(new ObjectMapper()),
        new CssRegionAddressStrategy(),
        new ZipAnchoredTextStrategy()
    )));

    @Test
    void followsNextLinksAndStopsOnPageWithoutNewLinks() throws Exception {
        MapFetcher fetcher = new MapFetcher()
            .page(START, resultsPage(List.of("/listing/1", "/listing/2", "/about"), "/fsbo?page=2"))
            .page("https://search.example.com/fsbo?page=2", resultsPage(List.of("/listing/3", "/listing/1"), "/fsbo?page=3"))
            .page("https://search.example.com/fsbo?page=3", resultsPage(List.of("/listing/2"), "/fsbo?page=4"))
            .page("https://search.example.com/fsbo?page=4", resultsPage(List.of("/listing/9"), null));

        List<FetchTarget> targets = extractor.discover(settings(20, 50), fetcher);

        assertThat(targets).extracting(FetchTarget::url).containsExactly(
            "https://search.example.com/listing/1",
            "https://search.example.com/listing/2",
            "https://search.example.com/listing/3"
        );
        assertThat(fetcher.requested()).hasSize(3);
    }

    @Test
    void pageCeilingBoundsDiscovery() throws Exception {
        MapFetcher fetcher = new MapFetcher()
            .page(START, resultsPage(List.of("/listing/1"), "/fsbo?page=2"))
            .page("https://search.example.com/fsbo?page=2", resultsPage(List.of("/listing/2"), "/fsbo?page=3"))
            .page("https://search.example.com/fsbo?page=3", resultsPage(List.of("/listing/3"), null));

        List<FetchTarget> targets = extractor.discover(settings(2, 50), fetcher);

        assertThat(targets).hasSize(2);
        assertThat(fetcher.requested()).hasSize(2);
    }

    @Test
    void maxListingsBoundsCollectedLinks() throws Exception {
        MapFetcher fetcher = new MapFetcher()
            .page(START, resultsPage(List.of("/listing/1", "/listing/2", "/listing/3"), "/fsbo?page=2"));

        List<FetchTarget> targets = extractor.discover(settings(20, 2), fetcher);

        assertThat(targets).hasSize(2);
        assertThat(fetcher.requested()).containsExactly(START);
    }

    @Test
    void failingFirstPageIsADiscoveryError() {
        assertThrows(DiscoveryException.class, () -> extractor.discover(settings(20, 50), new MapFetcher()));
    }

    @Test
    void missingLinkPatternIsADiscoveryError() {
        ScraperProperties.Source source = new ScraperProperties.Source();
        source.setStartUrls(List.of(START));
        ScraperProperties properties = new ScraperProperties();
        properties.getSources().put(PaginatedSearchExtractor.SOURCE_ID, source);

        assertThrows(
            DiscoveryException.class,
            () -> extractor.discover(properties.resolveSource(PaginatedSearchExtractor.SOURCE_ID), new MapFetcher())
        );
    }

    private SourceSettings settings(int maxPages, int maxListings) {
        ScraperProperties.Source source = new ScraperProperties.Source();
        source.setStartUrls(List.of(START));
        source.setListingLinkPattern("/listing/\\d+");
        source.setNextPageSelector("a.next");
        source.setMaxPages(maxPages);
        source.setMaxListings(maxListings);
        ScraperProperties properties = new ScraperProperties();
        properties.getSources().put(PaginatedSearchExtractor.SOURCE_ID, source);
        return properties.resolveSource(PaginatedSearchExtractor.SOURCE_ID);
    }

    private String resultsPage(List<String> links, String next) {
        StringBuilder html = new StringBuilder("<html><body><ul>");
        for (String link : links) {
            html.append("<li><a href=\"").append(link).append("\">home</a></li>");
        }
        html.append("</ul>");
        if (next != null) {
            html.append("<a class=\"next\" href=\"").append(next).append("\">Next</a>");
        }
        return html.append("</body></html>").toString();
    }
}
