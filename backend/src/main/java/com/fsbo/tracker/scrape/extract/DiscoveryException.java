package com.fsbo.tracker.scrape.extract;

/**
 * Target discovery failed; the run ends before any target is fetched.
 */
public class DiscoveryException extends Exception {
    public DiscoveryException(String message) {
        super(message);
    }

    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
