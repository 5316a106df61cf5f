package com.fsbo.tracker.scrape.persistence;

import com.fsbo.tracker.scrape.model.Listing;
import com.fsbo.tracker.scrape.model.ListingDraft;
import com.fsbo.tracker.scrape.model.ListingQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Repository
public class ListingJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(ListingJdbcRepository.class);

    private static final String INSERT_COLUMNS = """
        INSERT INTO listings (
            street, city, state, zip_code, listing_url, source_website,
            scraped_at, last_updated, fingerprint, is_exported, notes
        )
        VALUES (
            :street, :city, :state, :zipCode, :listingUrl, :sourceWebsite,
            :scrapedAt, :scrapedAt, :fingerprint, FALSE, :notes
        )
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;
    private final RowMapper<Listing> listingMapper = (rs, rowNum) -> new Listing(
        rs.getLong("id"),
        rs.getString("street"),
        rs.getString("city"),
        rs.getString("state"),
        rs.getString("zip_code"),
        rs.getString("listing_url"),
        rs.getString("source_website"),
        toInstant(rs.getTimestamp("scraped_at")),
        toInstant(rs.getTimestamp("last_updated")),
        rs.getString("fingerprint"),
        rs.getBoolean("is_exported"),
        rs.getString("notes")
    );

    public ListingJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.postgres = detectPostgres(jdbc);
    }

    /**
     * Inserts one listing unless its fingerprint is already stored.
     *
     * @return the new id, or null when the fingerprint was a duplicate
     */
    public Long insertIfAbsent(ListingDraft draft, String fingerprint, Instant scrapedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("street", draft.address().street())
            .addValue("city", draft.address().city())
            .addValue("state", draft.address().state())
            .addValue("zipCode", draft.address().zipCode())
            .addValue("listingUrl", draft.listingUrl())
            .addValue("sourceWebsite", draft.sourceWebsite())
            .addValue("scrapedAt", toTimestamp(scrapedAt))
            .addValue("fingerprint", fingerprint)
            .addValue("notes", draft.notes());
        KeyHolder keyHolder = new GeneratedKeyHolder();
        if (postgres) {
            int inserted = jdbc.update(
                INSERT_COLUMNS + "ON CONFLICT (fingerprint) DO NOTHING",
                params,
                keyHolder,
                new String[] {"id"}
            );
            if (inserted == 0) {
                return null;
            }
        } else {
            if (existsByFingerprint(fingerprint)) {
                return null;
            }
            try {
                jdbc.update(INSERT_COLUMNS, params, keyHolder, new String[] {"id"});
            } catch (DuplicateKeyException e) {
                // lost a race with a concurrent insert of the same fingerprint
                log.debug("Duplicate fingerprint {} rejected by unique constraint", fingerprint);
                return null;
            }
        }
        Number key = keyHolder.getKey();
        return key == null ? null : key.longValue();
    }

    public boolean existsByFingerprint(String fingerprint) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM listings WHERE fingerprint = :fingerprint",
            new MapSqlParameterSource("fingerprint", fingerprint),
            Integer.class
        );
        return count != null && count > 0;
    }

    public List<Listing> findListings(ListingQuery query) {
        MapSqlParameterSource params = filterParams(query);
        StringBuilder sql = new StringBuilder("""
            SELECT id, street, city, state, zip_code, listing_url, source_website,
                   scraped_at, last_updated, fingerprint, is_exported, notes
            FROM listings
            """);
        sql.append(whereClause(query));
        sql.append(" ORDER BY scraped_at DESC, id DESC");
        if (query.limit() != null) {
            sql.append(" LIMIT :limit");
            params.addValue("limit", Math.max(0, query.limit()));
        }
        if (query.offset() > 0) {
            sql.append(" OFFSET :offset");
            params.addValue("offset", query.offset());
        }
        return jdbc.query(sql.toString(), params, listingMapper);
    }

    public long countListings(ListingQuery query) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM listings" + whereClause(query),
            filterParams(query),
            Long.class
        );
        return count == null ? 0L : count;
    }

    public Map<String, Long> countBySource() {
        Map<String, Long> counts = new LinkedHashMap<>();
        jdbc.query(
            """
                SELECT source_website, COUNT(*) AS total
                FROM listings
                GROUP BY source_website
                ORDER BY total DESC, source_website
                """,
            new MapSqlParameterSource(),
            rs -> {
                counts.put(rs.getString("source_website"), rs.getLong("total"));
            }
        );
        return counts;
    }

    public Optional<Listing> findById(long id) {
        List<Listing> rows = jdbc.query(
            """
                SELECT id, street, city, state, zip_code, listing_url, source_website,
                       scraped_at, last_updated, fingerprint, is_exported, notes
                FROM listings
                WHERE id = :id
                """,
            new MapSqlParameterSource("id", id),
            listingMapper
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public int markExported(Collection<Long> ids, Instant updatedAt) {
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("ids", ids)
            .addValue("updatedAt", toTimestamp(updatedAt));
        return jdbc.update(
            """
                UPDATE listings
                SET is_exported = TRUE,
                    last_updated = :updatedAt
                WHERE id IN (:ids)
                """,
            params
        );
    }

    public int deleteAll() {
        return jdbc.update("DELETE FROM listings", new MapSqlParameterSource());
    }

    private String whereClause(ListingQuery query) {
        StringBuilder where = new StringBuilder();
        if (query.source() != null && !query.source().isBlank()) {
            where.append(" WHERE source_website = :source");
        }
        if (query.exported() != null) {
            where.append(where.length() == 0 ? " WHERE " : " AND ");
            where.append("is_exported = :exported");
        }
        return where.toString();
    }

    private MapSqlParameterSource filterParams(ListingQuery query) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        if (query.source() != null && !query.source().isBlank()) {
            params.addValue("source", query.source().trim());
        }
        if (query.exported() != null) {
            params.addValue("exported", query.exported());
        }
        return params;
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; using portable duplicate handling", e);
            return false;
        }
    }
}
