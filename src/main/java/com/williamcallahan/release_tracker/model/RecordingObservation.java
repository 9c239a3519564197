package com.williamcallahan.release_tracker.model;

import java.time.LocalDate;

/**
 * A recording as seen on one catalog entry during the current run.
 */
public record RecordingObservation(String isrc, LocalDate releaseDate, String albumName) {

    public boolean hasIsrc() {
        return isrc != null && !isrc.isBlank();
    }
}
