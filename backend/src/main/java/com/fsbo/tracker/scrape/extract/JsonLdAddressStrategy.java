package com.fsbo.tracker.scrape.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fsbo.tracker.scrape.model.RawListingCandidate;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * schema.org {@code PostalAddress} blocks from {@code application/ld+json} scripts,
 * including addresses nested in {@code ItemList} elements.
 */
@Component
public class JsonLdAddressStrategy implements AddressExtractionStrategy {
    private static final Logger log = LoggerFactory.getLogger(JsonLdAddressStrategy.class);

    private final ObjectMapper objectMapper;

    public JsonLdAddressStrategy(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "json_ld";
    }

    @Override
    public int order() {
        return 10;
    }

    @Override
    public List<RawListingCandidate> extract(Document document, String pageUrl) {
        List<RawListingCandidate> out = new ArrayList<>();
        for (Element script : document.select("script[type=application/ld+json]")) {
            String payload = script.data();
            if (payload == null || payload.isBlank()) {
                payload = script.html();
            }
            if (payload == null || payload.isBlank()) {
                continue;
            }
            try {
                JsonNode root = objectMapper.readTree(payload);
                collectAddresses(root, null, pageUrl, out);
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed JSON-LD block on {}: {}", pageUrl, e.getOriginalMessage());
            }
        }
        return out;
    }

    private void collectAddresses(JsonNode node, String itemUrl, String pageUrl, List<RawListingCandidate> out) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                collectAddresses(child, itemUrl, pageUrl, out);
            }
            return;
        }
        if (!node.isObject()) {
            return;
        }
        String url = firstNonBlank(text(node, "url"), itemUrl);
        if (isPostalAddress(node)) {
            out.add(new RawListingCandidate(
                text(node, "streetAddress"),
                text(node, "addressLocality"),
                text(node, "addressRegion"),
                text(node, "postalCode"),
                firstNonBlank(url, pageUrl),
                null
            ));
            return;
        }
        node.fields().forEachRemaining(entry -> {
            JsonNode value = entry.getValue();
            if (value.isArray() || value.isObject()) {
                collectAddresses(value, url, pageUrl, out);
            }
        });
    }

    private boolean isPostalAddress(JsonNode node) {
        JsonNode type = node.get("@type");
        if (type != null && type.isTextual() && "postaladdress".equalsIgnoreCase(type.asText())) {
            return true;
        }
        if (type != null && type.isArray()) {
            for (JsonNode child : type) {
                if (child.isTextual() && "postaladdress".equalsIgnoreCase(child.asText())) {
                    return true;
                }
            }
        }
        return node.hasNonNull("streetAddress");
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return "";
        }
        return value.asText("").trim();
    }

    private String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
