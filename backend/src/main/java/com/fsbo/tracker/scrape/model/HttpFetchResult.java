package com.fsbo.tracker.scrape.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of a single HTTP attempt. Transport failures carry a status of 0 and an
 * {@code errorCode}; a received response never has an error code.
 */
public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public static HttpFetchResult response(
        String requestedUrl,
        URI finalUri,
        int statusCode,
        String body,
        String contentType,
        Instant startedAt,
        Instant fetchedAt
    ) {
        return new HttpFetchResult(
            requestedUrl, finalUri, statusCode, body, contentType, fetchedAt, Duration.between(startedAt, fetchedAt), null, null
        );
    }

    public static HttpFetchResult failure(
        String requestedUrl,
        String errorCode,
        String errorMessage,
        Instant startedAt,
        Instant failedAt
    ) {
        return new HttpFetchResult(
            requestedUrl, null, 0, null, null, failedAt, Duration.between(startedAt, failedAt), errorCode, errorMessage
        );
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public boolean hasResponse() {
        return errorCode == null && statusCode > 0;
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }
}
