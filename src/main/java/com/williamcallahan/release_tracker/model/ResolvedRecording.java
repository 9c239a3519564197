package com.williamcallahan.release_tracker.model;

import java.time.LocalDate;

/**
 * Effective date and album of a recording after ISRC resolution.
 */
public record ResolvedRecording(LocalDate releaseDate, String albumName) {
}
