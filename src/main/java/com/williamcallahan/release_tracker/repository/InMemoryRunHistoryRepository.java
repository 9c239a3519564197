package com.williamcallahan.release_tracker.repository;

import com.williamcallahan.release_tracker.model.RunRecord;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryRunHistoryRepository implements RunHistoryRepository {

    private final List<RunRecord> runs = new CopyOnWriteArrayList<>();

    @Override
    public void save(RunRecord record) {
        runs.add(record);
    }

    @Override
    public List<RunRecord> findRecent(int limit) {
        return runs.stream()
            .sorted(Comparator.comparing(RunRecord::runTimestamp).reversed())
            .limit(Math.max(0, limit))
            .toList();
    }

    @Override
    public Optional<Instant> findLastRunTimestamp() {
        return runs.stream().map(RunRecord::runTimestamp).max(Comparator.naturalOrder());
    }
}
