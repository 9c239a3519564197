package com.williamcallahan.release_tracker.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;

/**
 * Unit of discovery output and of the release cache. Unique by {@code trackId}.
 * After ISRC resolution {@code releaseDate} and {@code albumName} describe the earliest known
 * appearance of the recording, not necessarily the entry that surfaced it.
 *
 * @param artistId artist the release was discovered for
 * @param albumId catalog entry that surfaced the track
 * @param trackId track identifier (cache key)
 * @param isrc recording code, may be {@code null}
 * @param releaseDate effective release date
 * @param albumName effective album name
 * @param trackName track title
 * @param albumType group of the surfacing entry
 * @param popularity upstream popularity score
 * @param url canonical track URL
 * @param fetchedAt when the release was last confirmed upstream, {@code null} before it is cached
 */
public record Release(
    String artistId,
    String albumId,
    String trackId,
    String isrc,
    LocalDate releaseDate,
    String albumName,
    String trackName,
    AlbumType albumType,
    int popularity,
    String url,
    Instant fetchedAt
) {

    /**
     * Presentation order of an artist's releases: release date descending, then track id.
     */
    public static final Comparator<Release> NEWEST_FIRST = Comparator.comparing(Release::releaseDate).reversed()
        .thenComparing(Release::trackId);

    public boolean hasIsrc() {
        return isrc != null && !isrc.isBlank();
    }

    /**
     * Copy carrying the effective date and album of the recording after ISRC resolution.
     */
    public Release withEffectiveRelease(LocalDate effectiveDate, String effectiveAlbumName) {
        return new Release(artistId, albumId, trackId, isrc, effectiveDate, effectiveAlbumName, trackName,
            albumType, popularity, url, fetchedAt);
    }

    public Release withArtistId(String owner) {
        return new Release(owner, albumId, trackId, isrc, releaseDate, albumName, trackName,
            albumType, popularity, url, fetchedAt);
    }

    public Release withFetchedAt(Instant timestamp) {
        return new Release(artistId, albumId, trackId, isrc, releaseDate, albumName, trackName,
            albumType, popularity, url, timestamp);
    }
}
