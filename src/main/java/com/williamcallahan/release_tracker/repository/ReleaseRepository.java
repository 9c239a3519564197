package com.williamcallahan.release_tracker.repository;

import com.williamcallahan.release_tracker.model.Release;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistent store of discovered releases, keyed by track id. Each artist that lists a track keeps
 * its own link to it with its own {@code fetchedAt}, so a collaboration cached for one artist is never
 * taken over by another.
 *
 * @author William Callahan
 */
public interface ReleaseRepository {

    /**
     * Releases linked to an artist dated on or after {@code cutoff}, newest first. Each carries the
     * requested artist id and the time that artist's fetch last confirmed it.
     *
     * @throws com.williamcallahan.release_tracker.exception.CacheCorruptionException when a stored row cannot be read back
     */
    List<Release> findByArtistSince(String artistId, LocalDate cutoff);

    /**
     * Release date of the artist's newest cached release, if any.
     */
    Optional<LocalDate> findLatestReleaseDate(String artistId);

    /**
     * Inserts or replaces releases by track id and links each to its {@code artistId}.
     * Every release must carry its {@code fetchedAt}.
     */
    void upsertAll(Collection<Release> releases);

    /**
     * Drops artist links confirmed before {@code threshold}, then any track no artist links to.
     *
     * @return number of artist links removed
     */
    int deleteFetchedBefore(Instant threshold);

    /**
     * Drops the artist's links, then any track no other artist links to.
     *
     * @return number of artist links removed
     */
    int deleteByArtist(String artistId);

    /**
     * Cheap round trip proving the store is reachable.
     *
     * @throws org.springframework.dao.DataAccessException when it is not
     */
    void verifyConnection();
}
