package com.williamcallahan.release_tracker.model;

import java.util.List;

/**
 * Result of a release cache lookup for one artist and cutoff.
 *
 * @param releases cached releases on or after the cutoff
 * @param stale whether the artist must be refetched
 */
public record CachedReleases(List<Release> releases, boolean stale) {

    public CachedReleases {
        releases = releases == null ? List.of() : List.copyOf(releases);
    }

    public static CachedReleases miss() {
        return new CachedReleases(List.of(), true);
    }

    public boolean isFresh() {
        return !stale;
    }
}
