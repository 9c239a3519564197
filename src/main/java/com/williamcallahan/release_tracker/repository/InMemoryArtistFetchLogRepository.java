package com.williamcallahan.release_tracker.repository;

import com.williamcallahan.release_tracker.model.ArtistFetchLog;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryArtistFetchLogRepository implements ArtistFetchLogRepository {

    private final Map<String, ArtistFetchLog> logs = new ConcurrentHashMap<>();

    @Override
    public Optional<ArtistFetchLog> find(String artistId) {
        return Optional.ofNullable(logs.get(artistId));
    }

    @Override
    public void record(String artistId, LocalDate cutoffDate, Instant fetchedAt) {
        logs.put(artistId, new ArtistFetchLog(artistId, cutoffDate, fetchedAt, false));
    }

    @Override
    public void invalidate(String artistId) {
        logs.computeIfPresent(artistId,
            (id, log) -> new ArtistFetchLog(id, log.cutoffDate(), log.fetchedAt(), true));
    }

    @Override
    public int delete(String artistId) {
        return logs.remove(artistId) == null ? 0 : 1;
    }
}
