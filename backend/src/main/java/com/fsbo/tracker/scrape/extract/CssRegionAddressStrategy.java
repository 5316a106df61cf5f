package com.fsbo.tracker.scrape.extract;

import com.fsbo.tracker.scrape.model.RawListingCandidate;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Text of the page regions where listing sites usually print the address.
 */
@Component
public class CssRegionAddressStrategy implements AddressExtractionStrategy {
    static final List<String> SELECTORS = List.of(
        "[itemprop=address]",
        "address",
        ".address",
        ".property-address",
        ".listing-address",
        "[class*=address]",
        "[class*=location]"
    );

    @Override
    public String name() {
        return "css_region";
    }

    @Override
    public int order() {
        return 20;
    }

    @Override
    public List<RawListingCandidate> extract(Document document, String pageUrl) {
        Set<String> texts = new LinkedHashSet<>();
        for (String selector : SELECTORS) {
            for (Element element : document.select(selector)) {
                String text = regionText(element);
                if (!text.isEmpty()) {
                    texts.add(text);
                }
            }
        }

        List<RawListingCandidate> out = new ArrayList<>();
        for (String text : texts) {
            if (!AddressLineParser.isLikelyAddress(text) || !AddressLineParser.isPlausibleAddressText(text)) {
                continue;
            }
            RawListingCandidate candidate = AddressLineParser.parse(text, pageUrl);
            if (AddressLineParser.isPlausibleStreet(candidate.street())) {
                out.add(candidate);
            }
        }
        return out;
    }

    // <br> separates street from city in most address blocks.
    private String regionText(Element element) {
        Element copy = element.clone();
        copy.select("br").after(", ");
        return AddressLineParser.collapseWhitespace(copy.text().replace(" ,", ","));
    }
}
