package com.fsbo.tracker.scrape.service;

import com.fsbo.tracker.scrape.model.ScrapeSession;
import com.fsbo.tracker.scrape.model.ScrapeStatus;
import com.fsbo.tracker.scrape.persistence.ScrapeSessionJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Service
public class SessionRecorder {
    private static final Logger log = LoggerFactory.getLogger(SessionRecorder.class);
    static final int DEFAULT_HISTORY_LIMIT = 10;

    private final ScrapeSessionJdbcRepository repository;
    private final Clock clock;

    public SessionRecorder(ScrapeSessionJdbcRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Appends one session row. The end timestamp is the moment of recording.
     */
    public ScrapeSession record(
        String sourceId,
        Instant startedAt,
        int found,
        int newCount,
        int duplicates,
        int errors,
        ScrapeStatus status,
        String errorMessage
    ) {
        Instant endedAt = clock.instant();
        Instant start = startedAt == null ? endedAt : startedAt;
        long id = repository.insertSession(sourceId, start, endedAt, found, newCount, duplicates, errors, status, errorMessage);
        log.info(
            "Session {} for {}: status={} found={} new={} duplicates={} errors={}",
            id,
            sourceId,
            status.dbValue(),
            found,
            newCount,
            duplicates,
            errors
        );
        return new ScrapeSession(id, sourceId, start, endedAt, found, newCount, duplicates, errors, status, errorMessage);
    }

    public List<ScrapeSession> history(String sourceId, Integer limit) {
        int effectiveLimit = limit == null ? DEFAULT_HISTORY_LIMIT : Math.max(1, limit);
        return repository.findHistory(sourceId, effectiveLimit);
    }
}
