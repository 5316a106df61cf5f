package com.fsbo.tracker.scrape.address;

public record NormalizedAddress(String street, String city, String state, String zipCode) {

    public boolean isComplete() {
        return AddressNormalizer.isValidAddress(street, city, state, zipCode);
    }

    public String mailingLabel() {
        return AddressNormalizer.formatMailingLabel(this);
    }
}
