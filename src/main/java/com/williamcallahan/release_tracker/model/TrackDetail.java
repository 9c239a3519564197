package com.williamcallahan.release_tracker.model;

/**
 * Track-level detail that only the per-track lookup returns.
 *
 * @param isrc International Standard Recording Code, {@code null} when the catalog has none
 * @param popularity upstream popularity score (0-100)
 * @param url canonical public URL of the track
 */
public record TrackDetail(String isrc, int popularity, String url) {

    public boolean hasIsrc() {
        return isrc != null && !isrc.isBlank();
    }
}
