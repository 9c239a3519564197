package com.williamcallahan.release_tracker.model;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

/**
 * Input of a discovery run.
 *
 * @param artistIds artists to process, in caller order
 * @param cutoffDate earliest release date still considered recent
 * @param forceRefresh bypass cache freshness for every artist
 * @param maxPerArtist optional popularity cap, {@code null} for no cap
 * @param timeout optional overall run deadline, {@code null} for none
 */
public record DiscoveryRequest(
    List<String> artistIds,
    LocalDate cutoffDate,
    boolean forceRefresh,
    Integer maxPerArtist,
    Duration timeout
) {

    public DiscoveryRequest {
        if (cutoffDate == null) {
            throw new IllegalArgumentException("cutoffDate is required");
        }
        if (maxPerArtist != null && maxPerArtist < 1) {
            throw new IllegalArgumentException("maxPerArtist must be positive when set, got " + maxPerArtist);
        }
        artistIds = artistIds == null ? List.of() : List.copyOf(artistIds);
    }

    public static DiscoveryRequest of(List<String> artistIds, LocalDate cutoffDate) {
        return new DiscoveryRequest(artistIds, cutoffDate, false, null, null);
    }
}
