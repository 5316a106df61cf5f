package com.fsbo.tracker.scrape.address;

import com.fsbo.tracker.scrape.util.HashUtils;

import java.util.Locale;

/**
 * Dedup key of a listing: MD5 over lower-cased street, city and state followed by the
 * ZIP digits.
 */
public final class ListingFingerprint {
    private ListingFingerprint() {
    }

    public static String of(NormalizedAddress address) {
        return of(address.street(), address.city(), address.state(), address.zipCode());
    }

    public static String of(String street, String city, String state, String zipCode) {
        String payload = lower(street) + lower(city) + lower(state) + digits(zipCode);
        return HashUtils.md5Hex(payload);
    }

    private static String lower(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    private static String digits(String value) {
        return value == null ? "" : value.replaceAll("\\D", "");
    }
}
