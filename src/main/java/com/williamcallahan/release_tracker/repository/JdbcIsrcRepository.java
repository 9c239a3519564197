package com.williamcallahan.release_tracker.repository;

import com.williamcallahan.release_tracker.exception.CacheCorruptionException;
import com.williamcallahan.release_tracker.model.IsrcEntry;
import com.williamcallahan.release_tracker.util.JdbcUtils;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.util.Optional;

/**
 * PostgreSQL-backed ISRC lookup cache. The conditional upsert keeps the earliest date
 * even when several workers resolve the same recording concurrently.
 */
@Repository
@ConditionalOnExpression("'${spring.datasource.url:}'.length() > 0")
public class JdbcIsrcRepository implements IsrcRepository {

    static final String UPSERT_SQL =
        "INSERT INTO isrc_lookup_cache (isrc, earliest_date, earliest_album_name, cached_at) VALUES (?, ?, ?, ?) " +
        "ON CONFLICT (isrc) DO UPDATE SET earliest_date = EXCLUDED.earliest_date, " +
        "earliest_album_name = EXCLUDED.earliest_album_name, cached_at = EXCLUDED.cached_at " +
        "WHERE EXCLUDED.earliest_date < isrc_lookup_cache.earliest_date";

    private final JdbcTemplate jdbcTemplate;

    public JdbcIsrcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<IsrcEntry> find(String isrc) {
        return JdbcUtils.queryForOptional(jdbcTemplate,
            "SELECT isrc, earliest_date, earliest_album_name, cached_at FROM isrc_lookup_cache WHERE isrc = ?",
            (rs, rowNum) -> {
                Date earliest = rs.getDate("earliest_date");
                if (earliest == null) {
                    throw new CacheCorruptionException("ISRC cache row for " + isrc + " has no earliest_date");
                }
                return new IsrcEntry(
                    rs.getString("isrc"),
                    earliest.toLocalDate(),
                    rs.getString("earliest_album_name"),
                    JdbcUtils.toInstant(rs.getTimestamp("cached_at"))
                );
            },
            isrc);
    }

    @Override
    public boolean upsertIfEarlier(IsrcEntry entry) {
        int updated = jdbcTemplate.update(UPSERT_SQL,
            entry.isrc(),
            JdbcUtils.toSqlDate(entry.earliestDate()),
            entry.earliestAlbumName(),
            JdbcUtils.toTimestamp(entry.cachedAt()));
        return updated > 0;
    }
}
