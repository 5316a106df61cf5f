package com.fsbo.tracker.scrape.http;

import com.fsbo.tracker.scrape.model.FetchTarget;

/**
 * Fetch session scoped to one source run. Opened at run start and closed on every exit
 * path of the run.
 */
public interface Fetcher extends AutoCloseable {

    String fetch(FetchTarget target) throws FetchException;

    default String fetch(String url) throws FetchException {
        return fetch(FetchTarget.of(url));
    }

    @Override
    void close();
}
