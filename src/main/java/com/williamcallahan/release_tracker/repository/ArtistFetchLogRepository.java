package com.williamcallahan.release_tracker.repository;

import com.williamcallahan.release_tracker.model.ArtistFetchLog;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Remembers which window was last fetched for each artist and when.
 */
public interface ArtistFetchLogRepository {

    Optional<ArtistFetchLog> find(String artistId);

    /**
     * Records a completed fetch and clears any pending invalidation.
     */
    void record(String artistId, LocalDate cutoffDate, Instant fetchedAt);

    /**
     * Flags the artist for refetch. Does nothing when the artist was never fetched.
     */
    void invalidate(String artistId);

    int delete(String artistId);
}
