/**
 * In-memory release cache for database-free execution
 *
 * @author William Callahan
 *
 * Features:
 * - Activated by NoDatabaseConfig when no database URL is configured
 * - Same track rows and per-artist links as the JDBC store
 * - Contents live for the lifetime of the process only
 */
package com.williamcallahan.release_tracker.repository;

import com.williamcallahan.release_tracker.model.Release;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryReleaseRepository implements ReleaseRepository {

    private final Map<String, Release> releasesByTrackId = new ConcurrentHashMap<>();

    // artist id -> track id -> when that artist last confirmed the track
    private final Map<String, Map<String, Instant>> linksByArtist = new ConcurrentHashMap<>();

    @Override
    public List<Release> findByArtistSince(String artistId, LocalDate cutoff) {
        return linked(artistId).stream()
            .filter(release -> !release.releaseDate().isBefore(cutoff))
            .sorted(Release.NEWEST_FIRST)
            .toList();
    }

    @Override
    public Optional<LocalDate> findLatestReleaseDate(String artistId) {
        return linked(artistId).stream()
            .map(Release::releaseDate)
            .max(LocalDate::compareTo);
    }

    private List<Release> linked(String artistId) {
        return linksByArtist.getOrDefault(artistId, Map.of()).entrySet().stream()
            .map(link -> {
                Release track = releasesByTrackId.get(link.getKey());
                return track == null ? null : track.withArtistId(artistId).withFetchedAt(link.getValue());
            })
            .filter(Objects::nonNull)
            .toList();
    }

    @Override
    public synchronized void upsertAll(Collection<Release> releases) {
        for (Release release : releases) {
            if (release.fetchedAt() == null) {
                throw new IllegalArgumentException("Release " + release.trackId() + " has no fetchedAt");
            }
            releasesByTrackId.put(release.trackId(), release);
            linksByArtist.computeIfAbsent(release.artistId(), id -> new ConcurrentHashMap<>())
                .put(release.trackId(), release.fetchedAt());
        }
    }

    @Override
    public synchronized int deleteFetchedBefore(Instant threshold) {
        int unlinked = 0;
        for (Map<String, Instant> links : linksByArtist.values()) {
            int before = links.size();
            links.values().removeIf(fetchedAt -> fetchedAt.isBefore(threshold));
            unlinked += before - links.size();
        }
        removeOrphans();
        return unlinked;
    }

    @Override
    public synchronized int deleteByArtist(String artistId) {
        Map<String, Instant> removed = linksByArtist.remove(artistId);
        removeOrphans();
        return removed == null ? 0 : removed.size();
    }

    private void removeOrphans() {
        linksByArtist.values().removeIf(Map::isEmpty);
        releasesByTrackId.keySet().removeIf(trackId -> linksByArtist.values().stream()
            .noneMatch(links -> links.containsKey(trackId)));
    }

    @Override
    public void verifyConnection() {
        // always reachable
    }

    /**
     * Number of distinct cached tracks.
     */
    public int size() {
        return releasesByTrackId.size();
    }
}
