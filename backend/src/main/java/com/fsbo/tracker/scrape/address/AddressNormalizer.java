package com.fsbo.tracker.scrape.address;

import com.fsbo.tracker.scrape.model.RawListingCandidate;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * USPS-style canonicalization of address fragments. Every method is pure and
 * idempotent: normalizing an already normalized value returns it unchanged.
 */
public final class AddressNormalizer {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_DIGIT = Pattern.compile("\\D");

    private static final Map<String, String> STATE_ABBREVIATIONS = new LinkedHashMap<>();
    private static final Map<String, String> DIRECTIONALS = new LinkedHashMap<>();
    private static final Map<String, String> STREET_TYPES = new LinkedHashMap<>();

    static {
        String[][] states = {
            {"alabama", "AL"}, {"alaska", "AK"}, {"arizona", "AZ"}, {"arkansas", "AR"},
            {"california", "CA"}, {"colorado", "CO"}, {"connecticut", "CT"}, {"delaware", "DE"},
            {"florida", "FL"}, {"georgia", "GA"}, {"hawaii", "HI"}, {"idaho", "ID"},
            {"illinois", "IL"}, {"indiana", "IN"}, {"iowa", "IA"}, {"kansas", "KS"},
            {"kentucky", "KY"}, {"louisiana", "LA"}, {"maine", "ME"}, {"maryland", "MD"},
            {"massachusetts", "MA"}, {"michigan", "MI"}, {"minnesota", "MN"}, {"mississippi", "MS"},
            {"missouri", "MO"}, {"montana", "MT"}, {"nebraska", "NE"}, {"nevada", "NV"},
            {"new hampshire", "NH"}, {"new jersey", "NJ"}, {"new mexico", "NM"}, {"new york", "NY"},
            {"north carolina", "NC"}, {"north dakota", "ND"}, {"ohio", "OH"}, {"oklahoma", "OK"},
            {"oregon", "OR"}, {"pennsylvania", "PA"}, {"rhode island", "RI"}, {"south carolina", "SC"},
            {"south dakota", "SD"}, {"tennessee", "TN"}, {"texas", "TX"}, {"utah", "UT"},
            {"vermont", "VT"}, {"virginia", "VA"}, {"washington", "WA"}, {"west virginia", "WV"},
            {"wisconsin", "WI"}, {"wyoming", "WY"}, {"district of columbia", "DC"}
        };
        for (String[] state : states) {
            STATE_ABBREVIATIONS.put(state[0], state[1]);
        }

        // Abbreviated forms map to themselves so title-casing "NE" -> "Ne" is undone.
        String[][] directionals = {
            {"northeast", "NE"}, {"northwest", "NW"}, {"southeast", "SE"}, {"southwest", "SW"},
            {"north", "N"}, {"south", "S"}, {"east", "E"}, {"west", "W"},
            {"ne", "NE"}, {"nw", "NW"}, {"se", "SE"}, {"sw", "SW"},
            {"n", "N"}, {"s", "S"}, {"e", "E"}, {"w", "W"}
        };
        for (String[] directional : directionals) {
            DIRECTIONALS.put(directional[0], directional[1]);
        }

        String[][] streetTypes = {
            {"street", "St"}, {"st", "St"}, {"avenue", "Ave"}, {"ave", "Ave"},
            {"road", "Rd"}, {"rd", "Rd"}, {"drive", "Dr"}, {"dr", "Dr"},
            {"boulevard", "Blvd"}, {"blvd", "Blvd"}, {"court", "Ct"}, {"ct", "Ct"},
            {"lane", "Ln"}, {"ln", "Ln"}, {"way", "Way"},
            {"circle", "Cir"}, {"cir", "Cir"}, {"trail", "Trl"}, {"trl", "Trl"},
            {"parkway", "Pkwy"}, {"pkwy", "Pkwy"}, {"plaza", "Plz"}, {"plz", "Plz"},
            {"terrace", "Ter"}, {"ter", "Ter"}, {"highway", "Hwy"}, {"hwy", "Hwy"}
        };
        for (String[] streetType : streetTypes) {
            STREET_TYPES.put(streetType[0], streetType[1]);
        }
    }

    private static final Pattern DIRECTIONAL_WORD = wordAlternation(DIRECTIONALS);
    private static final Pattern STREET_TYPE_WORD = wordAlternation(STREET_TYPES);

    private AddressNormalizer() {
    }

    public static NormalizedAddress normalize(String street, String city, String state, String zipCode) {
        return new NormalizedAddress(
            normalizeStreet(street),
            normalizeCity(city),
            normalizeState(state),
            normalizeZip(zipCode)
        );
    }

    public static NormalizedAddress normalize(RawListingCandidate candidate) {
        return normalize(candidate.street(), candidate.city(), candidate.state(), candidate.zipCode());
    }

    public static String normalizeStreet(String street) {
        if (street == null || street.isBlank()) {
            return "";
        }
        String value = titleCase(collapseWhitespace(street));
        value = replaceWords(value, DIRECTIONAL_WORD, DIRECTIONALS);
        value = replaceWords(value, STREET_TYPE_WORD, STREET_TYPES);
        return value.trim();
    }

    public static String normalizeCity(String city) {
        if (city == null || city.isBlank()) {
            return "";
        }
        return titleCase(collapseWhitespace(city)).trim();
    }

    /**
     * Two-letter input is upper-cased as-is, full names go through the 50 states + DC
     * table, anything else comes back upper-cased rather than rejected.
     */
    public static String normalizeState(String state) {
        if (state == null || state.isBlank()) {
            return "";
        }
        String value = collapseWhitespace(state).toLowerCase(Locale.ROOT);
        if (value.length() == 2 && Character.isLetter(value.charAt(0)) && Character.isLetter(value.charAt(1))) {
            return value.toUpperCase(Locale.ROOT);
        }
        String abbreviation = STATE_ABBREVIATIONS.get(value);
        if (abbreviation != null) {
            return abbreviation;
        }
        return value.toUpperCase(Locale.ROOT);
    }

    /**
     * Returns {@code 12345}, {@code 12345-6789}, or an empty string when the digits do
     * not form a ZIP or ZIP+4.
     */
    public static String normalizeZip(String zipCode) {
        if (zipCode == null || zipCode.isBlank()) {
            return "";
        }
        String digits = NON_DIGIT.matcher(zipCode).replaceAll("");
        if (digits.length() >= 9) {
            return digits.substring(0, 5) + "-" + digits.substring(5, 9);
        }
        if (digits.length() == 5) {
            return digits;
        }
        return "";
    }

    /**
     * True when all four fields are non-empty after normalization.
     */
    public static boolean isValidAddress(String street, String city, String state, String zipCode) {
        return notBlank(normalizeStreet(street))
            && notBlank(normalizeCity(city))
            && notBlank(normalizeState(state))
            && notBlank(normalizeZip(zipCode));
    }

    public static String formatMailingLabel(NormalizedAddress address) {
        return address.street() + "\n" + address.city() + ", " + address.state() + " " + address.zipCode();
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static String collapseWhitespace(String value) {
        return WHITESPACE.matcher(value.trim()).replaceAll(" ");
    }

    // Letters after digits stay lower case ("3rd"), letters after a separator start a word.
    private static String titleCase(String value) {
        StringBuilder out = new StringBuilder(value.length());
        char previous = ' ';
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isLetter(c)) {
                boolean wordStart = !Character.isLetterOrDigit(previous) && previous != '\'';
                out.append(wordStart ? Character.toUpperCase(c) : Character.toLowerCase(c));
            } else {
                out.append(c);
            }
            previous = c;
        }
        return out.toString();
    }

    private static String replaceWords(String value, Pattern pattern, Map<String, String> replacements) {
        Matcher matcher = pattern.matcher(value);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String replacement = replacements.get(matcher.group(1).toLowerCase(Locale.ROOT));
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static Pattern wordAlternation(Map<String, String> words) {
        return Pattern.compile("\\b(" + String.join("|", words.keySet()) + ")\\b", Pattern.CASE_INSENSITIVE);
    }
}
