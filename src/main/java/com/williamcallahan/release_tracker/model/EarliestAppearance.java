package com.williamcallahan.release_tracker.model;

import java.time.LocalDate;

/**
 * Earliest catalog appearance of a recording, as reported by an ISRC search.
 */
public record EarliestAppearance(LocalDate releaseDate, String albumName) {
}
