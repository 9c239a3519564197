package com.williamcallahan.release_tracker.model;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Records the window and time of an artist's last completed catalog fetch.
 *
 * @param artistId artist identifier
 * @param cutoffDate earliest release date the fetch covered
 * @param fetchedAt completion time of the fetch
 * @param invalidated set by a forced refresh; the next lookup must treat the artist as stale
 */
public record ArtistFetchLog(String artistId, LocalDate cutoffDate, Instant fetchedAt, boolean invalidated) {

    public boolean covers(LocalDate requestedCutoff) {
        return !cutoffDate.isAfter(requestedCutoff);
    }
}
