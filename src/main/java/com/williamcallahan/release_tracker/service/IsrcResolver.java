/**
 * Resolves the earliest known appearance of a recording by its ISRC
 *
 * @author William Callahan
 *
 * Features:
 * - Permanent ISRC store with a process-local Caffeine near cache
 * - Upstream lookup only for ISRCs never seen before
 * - Earlier observations replace the stored entry, later ones never do
 */
package com.williamcallahan.release_tracker.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.williamcallahan.release_tracker.client.CatalogClient;
import com.williamcallahan.release_tracker.model.EarliestAppearance;
import com.williamcallahan.release_tracker.model.IsrcEntry;
import com.williamcallahan.release_tracker.model.RecordingObservation;
import com.williamcallahan.release_tracker.model.ResolvedRecording;
import com.williamcallahan.release_tracker.repository.IsrcRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

@Service
@Slf4j
public class IsrcResolver {

    static final String OPERATION = "findEarliestByIsrc";

    private final IsrcRepository isrcRepository;
    private final Cache<String, IsrcEntry> nearCache;
    private final CatalogClient catalogClient;
    private final CatalogRetryPolicy retryPolicy;
    private final Clock clock;

    public IsrcResolver(IsrcRepository isrcRepository,
                        Cache<String, IsrcEntry> isrcNearCache,
                        CatalogClient catalogClient,
                        CatalogRetryPolicy retryPolicy,
                        Clock clock) {
        this.isrcRepository = isrcRepository;
        this.nearCache = isrcNearCache;
        this.catalogClient = catalogClient;
        this.retryPolicy = retryPolicy;
        this.clock = clock;
    }

    /**
     * Returns the effective release date and album of an observed recording.
     *
     * @param observation the recording as seen on the current catalog entry
     * @return the observation itself when it has no ISRC, else the earliest known appearance
     */
    public ResolvedRecording resolve(RecordingObservation observation) {
        if (!observation.hasIsrc()) {
            return new ResolvedRecording(observation.releaseDate(), observation.albumName());
        }
        String isrc = observation.isrc();
        Optional<IsrcEntry> cached = lookup(isrc);
        if (cached.isPresent()) {
            IsrcEntry entry = cached.get();
            if (!entry.isLaterThan(observation.releaseDate())) {
                return toResolved(entry);
            }
            log.debug("ISRC {} observed on {} before cached date {}", isrc, observation.releaseDate(), entry.earliestDate());
            return toResolved(store(new IsrcEntry(isrc, observation.releaseDate(), observation.albumName(), clock.instant())));
        }

        Optional<EarliestAppearance> upstream = retryPolicy.execute(OPERATION, () -> catalogClient.findEarliestByIsrc(isrc));
        IsrcEntry candidate = upstream
            .filter(appearance -> appearance.releaseDate().isBefore(observation.releaseDate()))
            .map(appearance -> new IsrcEntry(isrc, appearance.releaseDate(), appearance.albumName(), clock.instant()))
            .orElseGet(() -> new IsrcEntry(isrc, observation.releaseDate(), observation.albumName(), clock.instant()));
        return toResolved(store(candidate));
    }

    private Optional<IsrcEntry> lookup(String isrc) {
        IsrcEntry near = nearCache.getIfPresent(isrc);
        if (near != null) {
            return Optional.of(near);
        }
        Optional<IsrcEntry> stored = isrcRepository.find(isrc);
        stored.ifPresent(entry -> nearCache.put(isrc, entry));
        return stored;
    }

    /**
     * Writes the candidate when it is earlier than what the store holds and returns the winner.
     * Another worker may have stored an even earlier date in the meantime.
     */
    private IsrcEntry store(IsrcEntry candidate) {
        IsrcEntry winner = candidate;
        if (!isrcRepository.upsertIfEarlier(candidate)) {
            winner = isrcRepository.find(candidate.isrc()).orElse(candidate);
        }
        nearCache.put(winner.isrc(), winner);
        return winner;
    }

    private static ResolvedRecording toResolved(IsrcEntry entry) {
        return new ResolvedRecording(entry.earliestDate(), entry.earliestAlbumName());
    }
}
