package com.williamcallahan.release_tracker.model;

import java.time.LocalDate;

/**
 * One album, single or compilation from an artist's catalog page.
 *
 * @param id catalog entry (album) identifier
 * @param name entry title
 * @param type group the entry was listed under
 * @param releaseDate parsed release date with missing month/day defaulted to the 1st, {@code null} when unparseable
 * @param datePrecision precision of the raw upstream date
 * @param artistId artist whose catalog listed this entry
 */
public record CatalogEntry(
    String id,
    String name,
    AlbumType type,
    LocalDate releaseDate,
    DatePrecision datePrecision,
    String artistId
) {

    public boolean hasReleaseDate() {
        return releaseDate != null;
    }

    public boolean isOnOrAfter(LocalDate cutoffDate) {
        return releaseDate != null && !releaseDate.isBefore(cutoffDate);
    }
}
