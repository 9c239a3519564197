package com.williamcallahan.release_tracker.model;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Permanent ISRC lookup result. Never expires; only replaced by a strictly earlier date.
 *
 * @param isrc recording code (primary key)
 * @param earliestDate earliest known release date of the recording
 * @param earliestAlbumName album the recording first appeared on
 * @param cachedAt when this value was stored
 */
public record IsrcEntry(String isrc, LocalDate earliestDate, String earliestAlbumName, Instant cachedAt) {

    public boolean isLaterThan(LocalDate candidate) {
        return candidate != null && candidate.isBefore(earliestDate);
    }
}
