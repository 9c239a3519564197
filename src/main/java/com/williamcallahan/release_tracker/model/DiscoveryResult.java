package com.williamcallahan.release_tracker.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate output of a discovery run.
 *
 * @param releasesByArtist releases per successfully processed artist (empty list when none are recent)
 * @param missingArtists artists that failed, with the reason
 * @param callCounts upstream calls made during the run, by operation name
 */
public record DiscoveryResult(
    Map<String, List<Release>> releasesByArtist,
    List<MissingArtist> missingArtists,
    Map<String, Long> callCounts
) {

    public DiscoveryResult {
        releasesByArtist = Collections.unmodifiableMap(new LinkedHashMap<>(releasesByArtist));
        missingArtists = List.copyOf(missingArtists);
        callCounts = Collections.unmodifiableMap(new LinkedHashMap<>(callCounts));
    }

    public int totalReleases() {
        return releasesByArtist.values().stream().mapToInt(List::size).sum();
    }

    public long totalCalls() {
        return callCounts.values().stream().mapToLong(Long::longValue).sum();
    }
}
