package com.williamcallahan.release_tracker.repository;

import com.williamcallahan.release_tracker.model.RunRecord;
import com.williamcallahan.release_tracker.util.JdbcUtils;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
@ConditionalOnExpression("'${spring.datasource.url:}'.length() > 0")
public class JdbcRunHistoryRepository implements RunHistoryRepository {

    private final JdbcTemplate jdbcTemplate;

    public JdbcRunHistoryRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void save(RunRecord record) {
        jdbcTemplate.update(
            "INSERT INTO run_history (run_timestamp, artists_tracked, releases_found, lookback_days, duration_seconds, api_calls_made, status) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?)",
            JdbcUtils.toTimestamp(record.runTimestamp()),
            record.artistsTracked(),
            record.releasesFound(),
            record.lookbackDays(),
            record.durationSeconds(),
            record.apiCallsMade(),
            record.status());
    }

    @Override
    public List<RunRecord> findRecent(int limit) {
        return jdbcTemplate.query(
            "SELECT run_timestamp, artists_tracked, releases_found, lookback_days, duration_seconds, api_calls_made, status " +
            "FROM run_history ORDER BY run_timestamp DESC LIMIT ?",
            (rs, rowNum) -> new RunRecord(
                JdbcUtils.toInstant(rs.getTimestamp("run_timestamp")),
                rs.getInt("artists_tracked"),
                rs.getInt("releases_found"),
                rs.getInt("lookback_days"),
                rs.getDouble("duration_seconds"),
                rs.getLong("api_calls_made"),
                rs.getString("status")),
            limit);
    }

    @Override
    public Optional<Instant> findLastRunTimestamp() {
        return JdbcUtils.queryForOptional(jdbcTemplate, "SELECT MAX(run_timestamp) FROM run_history", Timestamp.class)
            .map(Timestamp::toInstant);
    }
}
