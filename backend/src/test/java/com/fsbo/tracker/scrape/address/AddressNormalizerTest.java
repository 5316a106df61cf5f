package com.fsbo.tracker.scrape.address;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AddressNormalizerTest {

    @Test
    void streetIsTitleCasedAndAbbreviated() {
        assertEquals("123 Main St", AddressNormalizer.normalizeStreet("123 main street"));
        assertEquals("45 N Oak Ave", AddressNormalizer.normalizeStreet("  45   NORTH oak   avenue "));
        assertEquals("9 NE Harbor Blvd", AddressNormalizer.normalizeStreet("9 northeast harbor boulevard"));
        assertEquals("12 3rd Ln", AddressNormalizer.normalizeStreet("12 3RD LANE"));
        assertEquals("700 Pine Hwy", AddressNormalizer.normalizeStreet("700 pine highway"));
    }

    @Test
    void streetNormalizationIsIdempotent() {
        List<String> inputs = List.of(
            "123 main street",
            "45 north oak avenue",
            "9 SOUTHWEST harbor parkway",
            "1 e 3rd st",
            "88 O'Neil court"
        );
        for (String input : inputs) {
            String once = AddressNormalizer.normalizeStreet(input);
            assertEquals(once, AddressNormalizer.normalizeStreet(once), input);
        }
    }

    @Test
    void cityIsCollapsedAndTitleCased() {
        assertEquals("Springfield", AddressNormalizer.normalizeCity("springfield"));
        assertEquals("Salt Lake City", AddressNormalizer.normalizeCity(" SALT   lake city "));
        assertEquals("", AddressNormalizer.normalizeCity(null));
    }

    @Test
    void stateNamesAndCodesMapToTwoLetterCodes() {
        assertEquals("IL", AddressNormalizer.normalizeState("illinois"));
        assertEquals("IL", AddressNormalizer.normalizeState("Illinois"));
        assertEquals("CA", AddressNormalizer.normalizeState("ca"));
        assertEquals("TX", AddressNormalizer.normalizeState("TX"));
        assertEquals("NY", AddressNormalizer.normalizeState("  New   York "));
        assertEquals("DC", AddressNormalizer.normalizeState("District of Columbia"));
    }

    @Test
    void everyStateNormalizesIdempotently() {
        List<String> names = List.of(
            "alabama", "alaska", "arizona", "arkansas", "california", "colorado", "connecticut",
            "delaware", "florida", "georgia", "hawaii", "idaho", "illinois", "indiana", "iowa",
            "kansas", "kentucky", "louisiana", "maine", "maryland", "massachusetts", "michigan",
            "minnesota", "mississippi", "missouri", "montana", "nebraska", "nevada", "new hampshire",
            "new jersey", "new mexico", "new york", "north carolina", "north dakota", "ohio",
            "oklahoma", "oregon", "pennsylvania", "rhode island", "south carolina", "south dakota",
            "tennessee", "texas", "utah", "vermont", "virginia", "washington", "west virginia",
            "wisconsin", "wyoming", "district of columbia"
        );
        for (String name : names) {
            String code = AddressNormalizer.normalizeState(name.toUpperCase());
            assertThat(code).as(name).hasSize(2).isUpperCase();
            assertEquals(code, AddressNormalizer.normalizeState(code), name);
            assertEquals(code, AddressNormalizer.normalizeState(code.toLowerCase()), name);
        }
    }

    @Test
    void unknownStateFallsBackToUpperCase() {
        assertEquals("ONTARIO", AddressNormalizer.normalizeState("Ontario"));
    }

    @Test
    void zipKeepsFiveOrNineDigits() {
        assertEquals("62701", AddressNormalizer.normalizeZip("62701"));
        assertEquals("62701-1234", AddressNormalizer.normalizeZip("62701-1234"));
        assertEquals("62701-1234", AddressNormalizer.normalizeZip("627011234"));
        assertEquals("", AddressNormalizer.normalizeZip("62"));
        assertEquals("", AddressNormalizer.normalizeZip("627012"));
        assertEquals("62701", AddressNormalizer.normalizeZip("ZIP: 62701"));
    }

    @Test
    void validityRequiresAllFourFields() {
        assertTrue(AddressNormalizer.isValidAddress("123 Main St", "Springfield", "IL", "62701"));
        assertFalse(AddressNormalizer.isValidAddress("123 Main St", "", "IL", "62701"));
        assertFalse(AddressNormalizer.isValidAddress("1 A St", "X", "IL", "62"));
        assertFalse(AddressNormalizer.isValidAddress("1 A St", "   ", "IL", "62701"));
        assertTrue(AddressNormalizer.isValidAddress("1 a street", "x", "illinois", "627011234"));
        assertFalse(AddressNormalizer.normalize("123 main st", "springfield", "il", "62").isComplete());
    }

    @Test
    void mailingLabelHasTwoLines() {
        NormalizedAddress address = AddressNormalizer.normalize("123 main street", "springfield", "illinois", "62701");
        assertEquals("123 Main St\nSpringfield, IL 62701", address.mailingLabel());
    }
}
