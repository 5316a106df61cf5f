package com.fsbo.tracker.scrape.extract;

import com.fsbo.tracker.scrape.model.RawListingCandidate;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Last resort: scans every visible text line for a ZIP. A ZIP line without its own
 * street (the {@code City, ST 12345} half of a two-line address) is joined with the
 * line before it.
 */
@Component
public class ZipAnchoredTextStrategy implements AddressExtractionStrategy {

    @Override
    public String name() {
        return "zip_text";
    }

    @Override
    public int order() {
        return 30;
    }

    @Override
    public List<RawListingCandidate> extract(Document document, String pageUrl) {
        Element root = document.body() != null ? document.body() : document;
        List<String> lines = textLines(root);

        Set<String> seen = new LinkedHashSet<>();
        List<RawListingCandidate> out = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (!AddressLineParser.containsZip(line)) {
                continue;
            }
            RawListingCandidate candidate = candidateFrom(line, pageUrl);
            if (candidate == null && i > 0) {
                candidate = candidateFrom(lines.get(i - 1) + ", " + line, pageUrl);
            }
            if (candidate != null && seen.add(candidate.street() + "|" + candidate.zipCode())) {
                out.add(candidate);
            }
        }
        return out;
    }

    private RawListingCandidate candidateFrom(String text, String pageUrl) {
        if (!AddressLineParser.isLikelyAddress(text) || !AddressLineParser.isPlausibleAddressText(text)) {
            return null;
        }
        RawListingCandidate candidate = AddressLineParser.parse(text, pageUrl);
        if (!AddressLineParser.isPlausibleStreet(candidate.street()) || candidate.city().isBlank()) {
            return null;
        }
        return candidate;
    }

    private List<String> textLines(Element root) {
        List<String> lines = new ArrayList<>();
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof TextNode) {
                String text = AddressLineParser.collapseWhitespace(((TextNode) node).text());
                if (!text.isEmpty()) {
                    lines.add(text);
                }
            }
        }, root);
        return lines;
    }
}
