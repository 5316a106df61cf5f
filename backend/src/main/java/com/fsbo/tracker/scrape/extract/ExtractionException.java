package com.fsbo.tracker.scrape.extract;

/**
 * Content that could not be parsed at all. Scoped to one target; the run continues.
 */
public class ExtractionException extends Exception {
    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
