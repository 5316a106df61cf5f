package com.fsbo.tracker.scrape.extract;

import com.fsbo.tracker.scrape.model.RawListingCandidate;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits free-text address lines such as {@code 123 Main St, Springfield, IL 62701} into
 * fields. Fields it cannot find are left blank.
 */
public final class AddressLineParser {
    private static final Pattern ZIP = Pattern.compile("\\b(\\d{5})(?:-(\\d{4}))?\\b");
    private static final Pattern FIVE_DIGITS = Pattern.compile("\\b\\d{5}\\b");
    private static final Pattern STREET_NUMBER = Pattern.compile("\\b\\d{1,5}\\b");
    private static final Pattern STATE_CODE = Pattern.compile("\\b([A-Z]{2})\\b");
    private static final Pattern DELIMITERS = Pattern.compile("[,/\\n]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MAX_TEXT_LENGTH = 240;
    private static final int MAX_WORDS = 28;
    private static final List<String> BLOCKED_PHRASES = List.of(
        "sign in", "sign up", "login", "continue with", "get started",
        "forgot password", "mortgage", "payment calculator", "home affordability",
        "welcome", "by clicking", "privacy", "terms", "list my property"
    );

    private AddressLineParser() {
    }

    public static RawListingCandidate parse(String line, String listingUrl) {
        if (line == null || line.isBlank()) {
            return new RawListingCandidate("", "", "", "", listingUrl, null);
        }
        String zip = extractZip(line);

        List<String> parts = new ArrayList<>();
        for (String part : DELIMITERS.split(line)) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                parts.add(trimmed);
            }
        }

        String street = parts.isEmpty() ? "" : parts.get(0);
        String city = "";
        String state = "";
        if (parts.size() >= 2) {
            boolean stateFound = false;
            for (int i = 1; i < parts.size(); i++) {
                Matcher matcher = STATE_CODE.matcher(parts.get(i));
                if (matcher.find()) {
                    state = matcher.group(1);
                    if (i > 1) {
                        city = parts.get(1);
                    }
                    stateFound = true;
                    break;
                }
            }
            if (!stateFound) {
                city = parts.get(1);
            }
        }
        return new RawListingCandidate(street, city, state, zip, listingUrl, null);
    }

    /**
     * First ZIP-shaped token including any +4 suffix, or an empty string.
     */
    public static String extractZip(String text) {
        if (text == null) {
            return "";
        }
        Matcher matcher = ZIP.matcher(text);
        return matcher.find() ? matcher.group() : "";
    }

    public static boolean containsZip(String text) {
        return text != null && FIVE_DIGITS.matcher(text).find();
    }

    /**
     * True when the text has both a street number and a ZIP.
     */
    public static boolean isLikelyAddress(String text) {
        if (text == null) {
            return false;
        }
        return STREET_NUMBER.matcher(text).find() && FIVE_DIGITS.matcher(text).find();
    }

    /**
     * Drops page chrome that happens to contain digits: long blocks, sign-in banners,
     * calculators.
     */
    public static boolean isPlausibleAddressText(String text) {
        if (text == null) {
            return false;
        }
        String cleaned = WHITESPACE.matcher(text).replaceAll(" ").trim();
        if (cleaned.length() > MAX_TEXT_LENGTH || cleaned.split(" ").length > MAX_WORDS) {
            return false;
        }
        if (!STREET_NUMBER.matcher(cleaned).find()) {
            return false;
        }
        String lower = cleaned.toLowerCase(Locale.ROOT);
        for (String phrase : BLOCKED_PHRASES) {
            if (lower.contains(phrase)) {
                return false;
            }
        }
        return true;
    }

    /**
     * A street line must carry a house number and must not be a price.
     */
    public static boolean isPlausibleStreet(String street) {
        if (street == null || street.isBlank()) {
            return false;
        }
        String trimmed = street.trim();
        return !trimmed.startsWith("$") && STREET_NUMBER.matcher(trimmed).find();
    }

    public static String collapseWhitespace(String text) {
        return text == null ? "" : WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}
