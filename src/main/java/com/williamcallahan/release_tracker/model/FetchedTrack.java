package com.williamcallahan.release_tracker.model;

/**
 * A track surfaced by catalog pagination together with its detail lookup,
 * before ISRC resolution and filtering.
 */
public record FetchedTrack(CatalogEntry entry, CatalogTrack track, TrackDetail detail) {

    /**
     * Builds the release exactly as observed on the surfacing entry.
     */
    public Release toObservedRelease() {
        return new Release(
            entry.artistId(),
            entry.id(),
            track.id(),
            detail.hasIsrc() ? detail.isrc() : null,
            entry.releaseDate(),
            entry.name(),
            track.name(),
            entry.type(),
            detail.popularity(),
            detail.url(),
            null
        );
    }
}
