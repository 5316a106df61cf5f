package com.fsbo.tracker.scrape.http;

import com.fsbo.tracker.scrape.model.HttpFetchResult;

import java.util.Set;

/**
 * A failed fetch: transport error, timeout, or a non-2xx response.
 */
public class FetchException extends Exception {
    public static final String TIMEOUT = "timeout";
    public static final String IO_ERROR = "io_error";
    public static final String INTERRUPTED = "interrupted";
    public static final String INVALID_URL = "invalid_url";
    public static final String HTTP_STATUS = "http_status";

    private final String url;
    private final int statusCode;
    private final String errorCode;

    public FetchException(String url, int statusCode, String errorCode, String message) {
        super(message);
        this.url = url;
        this.statusCode = statusCode;
        this.errorCode = errorCode;
    }

    public FetchException(String url, String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.statusCode = 0;
        this.errorCode = errorCode;
    }

    public static FetchException fromResult(HttpFetchResult result) {
        if (result.errorCode() != null) {
            return new FetchException(
                result.requestedUrl(),
                result.statusCode(),
                result.errorCode(),
                result.errorCode() + " fetching " + result.requestedUrl() + ": " + result.errorMessage()
            );
        }
        return new FetchException(
            result.requestedUrl(),
            result.statusCode(),
            HTTP_STATUS,
            "HTTP " + result.statusCode() + " fetching " + result.requestedUrl()
        );
    }

    /**
     * Network errors and timeouts are always retryable; a response is retryable only when
     * its status is in {@code retryableStatusCodes}.
     */
    public boolean isRetryable(Set<Integer> retryableStatusCodes) {
        if (TIMEOUT.equals(errorCode) || IO_ERROR.equals(errorCode)) {
            return true;
        }
        if (HTTP_STATUS.equals(errorCode)) {
            return retryableStatusCodes.contains(statusCode);
        }
        return false;
    }

    public String getUrl() {
        return url;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
