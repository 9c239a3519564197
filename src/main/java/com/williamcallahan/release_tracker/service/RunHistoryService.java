package com.williamcallahan.release_tracker.service;

import com.williamcallahan.release_tracker.model.DiscoveryResult;
import com.williamcallahan.release_tracker.model.MissingArtist;
import com.williamcallahan.release_tracker.model.RunRecord;
import com.williamcallahan.release_tracker.repository.RunHistoryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Keeps a history of discovery runs. Recording is best effort and never fails a run.
 */
@Service
@Slf4j
public class RunHistoryService {

    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_PARTIAL = "partial";
    public static final String STATUS_DEADLINE_EXCEEDED = "deadline_exceeded";

    private final RunHistoryRepository runHistoryRepository;

    public RunHistoryService(RunHistoryRepository runHistoryRepository) {
        this.runHistoryRepository = runHistoryRepository;
    }

    /**
     * Persists a summary of a finished run.
     *
     * @return the stored record, or empty when it could not be stored
     */
    public Optional<RunRecord> recordRun(Instant startedAt, int artistsTracked, int lookbackDays,
                                         DiscoveryResult result, Duration duration) {
        RunRecord record = new RunRecord(
            startedAt,
            artistsTracked,
            result.totalReleases(),
            lookbackDays,
            duration.toMillis() / 1000.0,
            result.totalCalls(),
            statusOf(result)
        );
        try {
            runHistoryRepository.save(record);
            return Optional.of(record);
        } catch (RuntimeException e) {
            log.warn("Failed to record discovery run of {}: {}", startedAt, e.getMessage());
            return Optional.empty();
        }
    }

    static String statusOf(DiscoveryResult result) {
        List<MissingArtist> missing = result.missingArtists();
        if (missing.isEmpty()) {
            return STATUS_COMPLETED;
        }
        boolean deadlineHit = missing.stream()
            .anyMatch(artist -> artist.reason() == MissingArtist.Reason.DEADLINE_EXCEEDED);
        return deadlineHit ? STATUS_DEADLINE_EXCEEDED : STATUS_PARTIAL;
    }

    public List<RunRecord> recentRuns(int limit) {
        return runHistoryRepository.findRecent(limit);
    }

    public Optional<Instant> lastRunTimestamp() {
        return runHistoryRepository.findLastRunTimestamp();
    }
}
