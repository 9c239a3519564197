package com.williamcallahan.release_tracker.repository;

import com.williamcallahan.release_tracker.exception.CacheCorruptionException;
import com.williamcallahan.release_tracker.model.ArtistFetchLog;
import com.williamcallahan.release_tracker.util.JdbcUtils;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

@Repository
@ConditionalOnExpression("'${spring.datasource.url:}'.length() > 0")
public class JdbcArtistFetchLogRepository implements ArtistFetchLogRepository {

    private final JdbcTemplate jdbcTemplate;

    public JdbcArtistFetchLogRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<ArtistFetchLog> find(String artistId) {
        return JdbcUtils.queryForOptional(jdbcTemplate,
            "SELECT artist_id, cutoff_date, fetched_at, invalidated FROM artist_fetch_log WHERE artist_id = ?",
            (rs, rowNum) -> {
                Date cutoff = rs.getDate("cutoff_date");
                Timestamp fetchedAt = rs.getTimestamp("fetched_at");
                if (cutoff == null || fetchedAt == null) {
                    throw new CacheCorruptionException("Fetch log row for " + artistId + " is incomplete");
                }
                return new ArtistFetchLog(rs.getString("artist_id"), cutoff.toLocalDate(), fetchedAt.toInstant(),
                    rs.getBoolean("invalidated"));
            },
            artistId);
    }

    @Override
    public void record(String artistId, LocalDate cutoffDate, Instant fetchedAt) {
        jdbcTemplate.update(
            "INSERT INTO artist_fetch_log (artist_id, cutoff_date, fetched_at, invalidated) VALUES (?, ?, ?, FALSE) " +
            "ON CONFLICT (artist_id) DO UPDATE SET cutoff_date = EXCLUDED.cutoff_date, fetched_at = EXCLUDED.fetched_at, invalidated = FALSE",
            artistId,
            JdbcUtils.toSqlDate(cutoffDate),
            JdbcUtils.toTimestamp(fetchedAt));
    }

    @Override
    public void invalidate(String artistId) {
        jdbcTemplate.update("UPDATE artist_fetch_log SET invalidated = TRUE WHERE artist_id = ?", artistId);
    }

    @Override
    public int delete(String artistId) {
        return jdbcTemplate.update("DELETE FROM artist_fetch_log WHERE artist_id = ?", artistId);
    }
}
