package com.fsbo.tracker.scrape.address;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ListingFingerprintTest {

    @Test
    void caseAndSurroundingWhitespaceDoNotChangeFingerprint() {
        String a = ListingFingerprint.of("123 Main St", "Springfield", "IL", "62701");
        String b = ListingFingerprint.of("  123 MAIN ST ", "springfield ", " il", "62701");
        assertThat(a).isEqualTo(b).hasSize(32);
    }

    @Test
    void differentAddressesDiffer() {
        String a = ListingFingerprint.of("123 Main St", "Springfield", "IL", "62701");
        String b = ListingFingerprint.of("125 Main St", "Springfield", "IL", "62701");
        assertThat(a).isNotEqualTo(b);
    }

    @Test
    void normalizedVariantsCollapse() {
        NormalizedAddress first = AddressNormalizer.normalize("123 main street", "springfield", "illinois", "62701");
        NormalizedAddress second = AddressNormalizer.normalize("123 MAIN ST", "SPRINGFIELD", "IL", "62701");
        assertThat(ListingFingerprint.of(first)).isEqualTo(ListingFingerprint.of(second));
    }
}
