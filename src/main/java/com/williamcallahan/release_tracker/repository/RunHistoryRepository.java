package com.williamcallahan.release_tracker.repository;

import com.williamcallahan.release_tracker.model.RunRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface RunHistoryRepository {

    void save(RunRecord record);

    /**
     * Newest runs first.
     */
    List<RunRecord> findRecent(int limit);

    Optional<Instant> findLastRunTimestamp();
}
