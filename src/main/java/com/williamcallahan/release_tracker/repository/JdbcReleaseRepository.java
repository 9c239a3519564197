/**
 * PostgreSQL-backed release cache
 *
 * @author William Callahan
 *
 * Features:
 * - Batch upserts keyed by track id, with a separate artist link per listing artist
 * - Window reads per artist through the link table, ordered newest first
 * - Row mapping failures surface as CacheCorruptionException
 * - Administrative deletes by age or artist
 */
package com.williamcallahan.release_tracker.repository;

import com.williamcallahan.release_tracker.exception.CacheCorruptionException;
import com.williamcallahan.release_tracker.model.AlbumType;
import com.williamcallahan.release_tracker.model.Release;
import com.williamcallahan.release_tracker.util.JdbcUtils;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
@ConditionalOnExpression("'${spring.datasource.url:}'.length() > 0")
public class JdbcReleaseRepository implements ReleaseRepository {

    static final String UPSERT_SQL =
        "INSERT INTO releases_cache (track_id, album_id, isrc, release_date, album_name, track_name, album_type, popularity, url, fetched_at) " +
        "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?) " +
        "ON CONFLICT (track_id) DO UPDATE SET album_id = EXCLUDED.album_id, isrc = EXCLUDED.isrc, " +
        "release_date = EXCLUDED.release_date, album_name = EXCLUDED.album_name, track_name = EXCLUDED.track_name, " +
        "album_type = EXCLUDED.album_type, popularity = EXCLUDED.popularity, url = EXCLUDED.url, fetched_at = EXCLUDED.fetched_at";

    static final String LINK_UPSERT_SQL =
        "INSERT INTO artist_releases (artist_id, track_id, fetched_at) VALUES (?, ?, ?) " +
        "ON CONFLICT (artist_id, track_id) DO UPDATE SET fetched_at = EXCLUDED.fetched_at";

    static final String DELETE_ORPHANS_SQL =
        "DELETE FROM releases_cache r WHERE NOT EXISTS (SELECT 1 FROM artist_releases l WHERE l.track_id = r.track_id)";

    private final JdbcTemplate jdbcTemplate;

    private final RowMapper<Release> releaseRowMapper = this::mapRelease;

    public JdbcReleaseRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<Release> findByArtistSince(String artistId, LocalDate cutoff) {
        return jdbcTemplate.query(
            "SELECT r.track_id, l.artist_id, r.album_id, r.isrc, r.release_date, r.album_name, r.track_name, r.album_type, " +
            "r.popularity, r.url, l.fetched_at " +
            "FROM artist_releases l JOIN releases_cache r ON r.track_id = l.track_id " +
            "WHERE l.artist_id = ? AND r.release_date >= ? ORDER BY r.release_date DESC, r.track_id",
            releaseRowMapper,
            artistId,
            JdbcUtils.toSqlDate(cutoff)
        );
    }

    @Override
    public Optional<LocalDate> findLatestReleaseDate(String artistId) {
        return JdbcUtils.queryForOptional(jdbcTemplate,
                "SELECT MAX(r.release_date) FROM artist_releases l JOIN releases_cache r ON r.track_id = l.track_id WHERE l.artist_id = ?",
                java.sql.Date.class,
                artistId)
            .map(JdbcUtils::toLocalDate);
    }

    @Override
    @Transactional
    public void upsertAll(Collection<Release> releases) {
        if (releases == null || releases.isEmpty()) {
            return;
        }
        List<Object[]> batch = new ArrayList<>(releases.size());
        List<Object[]> links = new ArrayList<>(releases.size());
        for (Release release : releases) {
            if (release.fetchedAt() == null) {
                throw new IllegalArgumentException("Release " + release.trackId() + " has no fetchedAt");
            }
            batch.add(new Object[]{
                release.trackId(),
                release.albumId(),
                release.isrc(),
                JdbcUtils.toSqlDate(release.releaseDate()),
                release.albumName(),
                release.trackName(),
                release.albumType() == null ? null : release.albumType().apiValue(),
                release.popularity(),
                release.url(),
                JdbcUtils.toTimestamp(release.fetchedAt())
            });
            links.add(new Object[]{
                release.artistId(),
                release.trackId(),
                JdbcUtils.toTimestamp(release.fetchedAt())
            });
        }
        jdbcTemplate.batchUpdate(UPSERT_SQL, batch);
        jdbcTemplate.batchUpdate(LINK_UPSERT_SQL, links);
    }

    @Override
    @Transactional
    public int deleteFetchedBefore(Instant threshold) {
        int unlinked = jdbcTemplate.update("DELETE FROM artist_releases WHERE fetched_at < ?", JdbcUtils.toTimestamp(threshold));
        jdbcTemplate.update(DELETE_ORPHANS_SQL);
        return unlinked;
    }

    @Override
    @Transactional
    public int deleteByArtist(String artistId) {
        int unlinked = jdbcTemplate.update("DELETE FROM artist_releases WHERE artist_id = ?", artistId);
        jdbcTemplate.update(DELETE_ORPHANS_SQL);
        return unlinked;
    }

    @Override
    public void verifyConnection() {
        jdbcTemplate.queryForObject("SELECT 1", Integer.class);
    }

    private Release mapRelease(ResultSet rs, int rowNum) throws SQLException {
        String trackId = rs.getString("track_id");
        java.sql.Date releaseDate = rs.getDate("release_date");
        Timestamp fetchedAt = rs.getTimestamp("fetched_at");
        if (trackId == null || releaseDate == null || fetchedAt == null) {
            throw new CacheCorruptionException("Cached release row " + rowNum + " is missing track_id, release_date or fetched_at");
        }
        AlbumType albumType;
        try {
            albumType = AlbumType.fromApiValue(rs.getString("album_type"));
        } catch (IllegalArgumentException e) {
            throw new CacheCorruptionException("Cached release " + trackId + " has an unknown album type", e);
        }
        return new Release(
            rs.getString("artist_id"),
            rs.getString("album_id"),
            trackId,
            rs.getString("isrc"),
            releaseDate.toLocalDate(),
            rs.getString("album_name"),
            rs.getString("track_name"),
            albumType,
            rs.getInt("popularity"),
            rs.getString("url"),
            fetchedAt.toInstant()
        );
    }
}
