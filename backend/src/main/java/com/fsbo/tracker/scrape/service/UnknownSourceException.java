package com.fsbo.tracker.scrape.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class UnknownSourceException extends RuntimeException {
    public UnknownSourceException(String sourceId) {
        super("No extractor registered for source '" + sourceId + "'");
    }
}
