package com.fsbo.tracker.scrape.extract;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fsbo.tracker.scrape.model.RawListingCandidate;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AddressStrategyChainTest {
    private final AddressStrategyChain chain = new AddressStrategyChain(List.of(
        new ZipAnchoredTextStrategy(),
        new JsonLdAddressStrategy(new ObjectMapper()),
        new CssRegionAddressStrategy()
    ));

    @Test
    void strategiesRunInPriorityOrder() {
        assertThat(chain.strategyNames()).containsExactly("json_ld", "css_region", "zip_text");
    }

    @Test
    void jsonLdWinsWhenPresent() throws Exception {
        String html = """
            <html><head>
            <script type="application/ld+json">
            {"@context":"https://schema.org","@type":"ItemList","itemListElement":[
              {"@type":"SingleFamilyResidence","url":"https://example.com/homes/1",
               "address":{"@type":"PostalAddress","streetAddress":"123 main street",
                          "addressLocality":"springfield","addressRegion":"IL","postalCode":"62701"}},
              {"@type":"SingleFamilyResidence",
               "address":{"@type":"PostalAddress","streetAddress":"9 Elm Rd",
                          "addressLocality":"Madison","addressRegion":"WI","postalCode":"53703"}}
            ]}
            </script>
            </head><body><address>500 Other Way, Nowhere, CA 90001</address></body></html>
            """;

        List<RawListingCandidate> candidates = chain.extract(html, "https://example.com/list");

        assertEquals(2, candidates.size());
        assertEquals("123 main street", candidates.get(0).street());
        assertEquals("https://example.com/homes/1", candidates.get(0).listingUrl());
        assertEquals("https://example.com/list", candidates.get(1).listingUrl());
    }

    @Test
    void cssRegionUsedWithoutStructuredData() throws Exception {
        String html = """
            <html><body>
              <div class="property-address">742 Evergreen Terrace<br>Springfield, OR 97477</div>
              <div class="price">$250,000</div>
            </body></html>
            """;

        List<RawListingCandidate> candidates = chain.extract(html, "https://example.com/p/742");

        assertThat(candidates).hasSize(1);
        RawListingCandidate candidate = candidates.get(0);
        assertEquals("742 Evergreen Terrace", candidate.street());
        assertEquals("Springfield", candidate.city());
        assertEquals("OR", candidate.state());
        assertEquals("97477", candidate.zipCode());
    }

    @Test
    void zipTextJoinsTwoLineAddresses() throws Exception {
        String html = """
            <html><body>
              <h1>Home for sale by owner</h1>
              <p>12 Lake Shore Dr</p>
              <p>Chicago, IL 60601</p>
              <p>Call 555 1234 for a showing</p>
            </body></html>
            """;

        List<RawListingCandidate> candidates = chain.extract(html, "https://example.com/p/12");

        assertThat(candidates).hasSize(1);
        assertEquals("12 Lake Shore Dr", candidates.get(0).street());
        assertEquals("Chicago", candidates.get(0).city());
        assertEquals("IL", candidates.get(0).state());
    }

    @Test
    void pageWithoutAddressesYieldsNothing() throws Exception {
        assertThat(chain.extract("<html><body><p>Nothing here</p></body></html>", "https://example.com")).isEmpty();
    }

    @Test
    void failingStrategyIsIsolated() throws Exception {
        AddressExtractionStrategy broken = new AddressExtractionStrategy() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public int order() {
                return 0;
            }

            @Override
            public List<RawListingCandidate> extract(Document document, String pageUrl) {
                throw new IllegalStateException("boom");
            }
        };
        AddressStrategyChain withBroken = new AddressStrategyChain(List.of(broken, new CssRegionAddressStrategy()));

        List<RawListingCandidate> candidates = withBroken.extract(
            "<address>1 Pine Ct, Boise, ID 83702</address>",
            "https://example.com"
        );

        assertThat(candidates).hasSize(1);
    }

    @Test
    void allStrategiesFailingIsAnExtractionError() {
        AddressExtractionStrategy broken = new AddressExtractionStrategy() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public int order() {
                return 0;
            }

            @Override
            public List<RawListingCandidate> extract(Document document, String pageUrl) {
                throw new IllegalStateException("boom");
            }
        };
        AddressStrategyChain onlyBroken = new AddressStrategyChain(List.of(broken));

        assertThrows(ExtractionException.class, () -> onlyBroken.extract("<p>x</p>", "https://example.com"));
        assertThrows(ExtractionException.class, () -> onlyBroken.extract(null, "https://example.com"));
    }
}
