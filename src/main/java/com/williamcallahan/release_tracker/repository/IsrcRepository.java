package com.williamcallahan.release_tracker.repository;

import com.williamcallahan.release_tracker.model.IsrcEntry;

import java.util.Optional;

/**
 * Permanent store of the earliest known appearance of each recording.
 * Entries never expire; a stored entry is only replaced by a strictly earlier date.
 */
public interface IsrcRepository {

    Optional<IsrcEntry> find(String isrc);

    /**
     * Stores the entry when the ISRC is unknown or the entry's date is strictly earlier
     * than the stored one. Atomic per ISRC.
     *
     * @return {@code true} when the entry was written
     */
    boolean upsertIfEarlier(IsrcEntry entry);
}
