package com.williamcallahan.release_tracker.model;

import java.util.List;

/**
 * Per-artist result of a fetch orchestration: either releases or a failure.
 */
public record ArtistFetchOutcome(String artistId, List<Release> releases, boolean fromCache, MissingArtist failure) {

    public ArtistFetchOutcome {
        releases = releases == null ? List.of() : List.copyOf(releases);
    }

    public static ArtistFetchOutcome cached(String artistId, List<Release> releases) {
        return new ArtistFetchOutcome(artistId, releases, true, null);
    }

    public static ArtistFetchOutcome fetched(String artistId, List<Release> releases) {
        return new ArtistFetchOutcome(artistId, releases, false, null);
    }

    public static ArtistFetchOutcome failed(String artistId, MissingArtist.Reason reason, String message) {
        return new ArtistFetchOutcome(artistId, List.of(), false, new MissingArtist(artistId, reason, message));
    }

    public boolean isFailure() {
        return failure != null;
    }
}
