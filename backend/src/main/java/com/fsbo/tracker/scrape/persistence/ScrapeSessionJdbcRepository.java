package com.fsbo.tracker.scrape.persistence;

import com.fsbo.tracker.scrape.model.ScrapeSession;
import com.fsbo.tracker.scrape.model.ScrapeStatus;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * Append-only audit trail of scrape runs. Rows are never updated.
 */
@Repository
public class ScrapeSessionJdbcRepository {
    private final NamedParameterJdbcTemplate jdbc;
    private final RowMapper<ScrapeSession> sessionMapper = (rs, rowNum) -> new ScrapeSession(
        rs.getLong("id"),
        rs.getString("source_website"),
        toInstant(rs.getTimestamp("scrape_start")),
        toInstant(rs.getTimestamp("scrape_end")),
        rs.getInt("listings_found"),
        rs.getInt("listings_new"),
        rs.getInt("listings_duplicates"),
        rs.getInt("errors"),
        ScrapeStatus.fromDbValue(rs.getString("status")),
        rs.getString("error_message")
    );

    public ScrapeSessionJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public long insertSession(
        String sourceWebsite,
        Instant scrapeStart,
        Instant scrapeEnd,
        int listingsFound,
        int listingsNew,
        int listingsDuplicates,
        int errors,
        ScrapeStatus status,
        String errorMessage
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sourceWebsite", sourceWebsite)
            .addValue("scrapeStart", toTimestamp(scrapeStart))
            .addValue("scrapeEnd", toTimestamp(scrapeEnd))
            .addValue("listingsFound", listingsFound)
            .addValue("listingsNew", listingsNew)
            .addValue("listingsDuplicates", listingsDuplicates)
            .addValue("errors", errors)
            .addValue("status", status.dbValue())
            .addValue("errorMessage", errorMessage);
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO scrape_sessions (
                    source_website, scrape_start, scrape_end, listings_found, listings_new,
                    listings_duplicates, errors, status, error_message
                )
                VALUES (
                    :sourceWebsite, :scrapeStart, :scrapeEnd, :listingsFound, :listingsNew,
                    :listingsDuplicates, :errors, :status, :errorMessage
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    public List<ScrapeSession> findHistory(String sourceWebsite, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("limit", Math.max(1, limit));
        String where = "";
        if (sourceWebsite != null && !sourceWebsite.isBlank()) {
            where = "WHERE source_website = :sourceWebsite\n";
            params.addValue("sourceWebsite", sourceWebsite.trim());
        }
        return jdbc.query(
            """
                SELECT id, source_website, scrape_start, scrape_end, listings_found, listings_new,
                       listings_duplicates, errors, status, error_message
                FROM scrape_sessions
                """ + where + """
                ORDER BY scrape_start DESC, id DESC
                LIMIT :limit
                """,
            params,
            sessionMapper
        );
    }

    public int deleteAll() {
        return jdbc.update("DELETE FROM scrape_sessions", new MapSqlParameterSource());
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
