package com.williamcallahan.release_tracker.repository;

import com.williamcallahan.release_tracker.model.IsrcEntry;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory ISRC cache. {@link ConcurrentHashMap#compute} gives the same per-key atomicity
 * as the conditional upsert of the JDBC store.
 */
public class InMemoryIsrcRepository implements IsrcRepository {

    private final Map<String, IsrcEntry> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<IsrcEntry> find(String isrc) {
        return Optional.ofNullable(entries.get(isrc));
    }

    @Override
    public boolean upsertIfEarlier(IsrcEntry entry) {
        boolean[] written = {false};
        entries.compute(entry.isrc(), (isrc, existing) -> {
            if (existing == null || existing.isLaterThan(entry.earliestDate())) {
                written[0] = true;
                return entry;
            }
            return existing;
        });
        return written[0];
    }
}
