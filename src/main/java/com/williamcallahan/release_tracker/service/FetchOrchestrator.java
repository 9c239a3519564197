/**
 * Runs the per-artist discovery pipeline across a bounded worker pool
 *
 * @author William Callahan
 *
 * Features:
 * - One task per artist; artists fail independently
 * - Fresh cache hits cost no upstream calls
 * - Pipeline: fetch, ISRC resolution, cutoff on the effective date, noise filter, ISRC dedup, write-through
 * - Honors the run deadline; unfinished artists are reported instead of awaited
 */
package com.williamcallahan.release_tracker.service;

import com.williamcallahan.release_tracker.model.ArtistFetchOutcome;
import com.williamcallahan.release_tracker.model.CachedReleases;
import com.williamcallahan.release_tracker.model.FetchedTrack;
import com.williamcallahan.release_tracker.model.MissingArtist;
import com.williamcallahan.release_tracker.model.RecordingObservation;
import com.williamcallahan.release_tracker.model.Release;
import com.williamcallahan.release_tracker.model.ResolvedRecording;
import com.williamcallahan.release_tracker.model.RunControl;
import com.williamcallahan.release_tracker.monitoring.MetricsService;
import com.williamcallahan.release_tracker.service.cache.ReleaseCacheService;
import com.williamcallahan.release_tracker.util.ErrorHandlingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Service
@Slf4j
public class FetchOrchestrator {

    private final ReleaseCacheService releaseCacheService;
    private final PaginatedCatalogFetcher catalogFetcher;
    private final IsrcResolver isrcResolver;
    private final NoiseFilter noiseFilter;
    private final MetricsService metricsService;
    private final Executor artistFetchExecutor;

    public FetchOrchestrator(ReleaseCacheService releaseCacheService,
                             PaginatedCatalogFetcher catalogFetcher,
                             IsrcResolver isrcResolver,
                             NoiseFilter noiseFilter,
                             MetricsService metricsService,
                             @Qualifier("artistFetchExecutor") Executor artistFetchExecutor) {
        this.releaseCacheService = releaseCacheService;
        this.catalogFetcher = catalogFetcher;
        this.isrcResolver = isrcResolver;
        this.noiseFilter = noiseFilter;
        this.metricsService = metricsService;
        this.artistFetchExecutor = artistFetchExecutor;
    }

    /**
     * Processes every artist and returns one outcome per artist, in request order.
     *
     * @param artistIds distinct artist ids
     * @param cutoffDate earliest release date to keep
     * @param forceRefresh ignore cache freshness
     * @param control run deadline and cancellation
     */
    public Map<String, ArtistFetchOutcome> run(List<String> artistIds, LocalDate cutoffDate,
                                               boolean forceRefresh, RunControl control) {
        Map<String, CompletableFuture<ArtistFetchOutcome>> tasks = new LinkedHashMap<>();
        for (String artistId : artistIds) {
            tasks.put(artistId, CompletableFuture.supplyAsync(
                () -> processArtist(artistId, cutoffDate, forceRefresh, control), artistFetchExecutor));
        }

        awaitCompletion(tasks, control);

        Map<String, ArtistFetchOutcome> outcomes = new LinkedHashMap<>();
        tasks.forEach((artistId, task) -> {
            if (task.isDone() && !task.isCompletedExceptionally()) {
                outcomes.put(artistId, task.join());
            } else if (task.isCompletedExceptionally()) {
                Throwable failure = task.handle((outcome, error) -> error).join();
                outcomes.put(artistId, ArtistFetchOutcome.failed(artistId, ErrorHandlingUtils.categorize(failure),
                    ErrorHandlingUtils.describe(failure)));
            } else {
                // running tasks see the cancelled RunControl and stop before their next call
                task.cancel(false);
                outcomes.put(artistId, ArtistFetchOutcome.failed(artistId, MissingArtist.Reason.DEADLINE_EXCEEDED,
                    "Artist did not complete before the run deadline"));
            }
        });
        return outcomes;
    }

    private void awaitCompletion(Map<String, CompletableFuture<ArtistFetchOutcome>> tasks, RunControl control) {
        CompletableFuture<Void> all = CompletableFuture.allOf(tasks.values().toArray(new CompletableFuture[0]));
        Optional<Duration> remaining = control.remaining();
        try {
            if (remaining.isPresent()) {
                all.get(remaining.get().toMillis(), TimeUnit.MILLISECONDS);
            } else {
                all.get();
            }
        } catch (TimeoutException e) {
            long unfinished = tasks.values().stream().filter(task -> !task.isDone()).count();
            log.warn("Run deadline reached with {} artist(s) unfinished; cancelling", unfinished);
            control.cancel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for artist fetches; cancelling run");
            control.cancel();
        } catch (ExecutionException e) {
            // reported per artist by run()
            log.error("Unexpected failure in artist fetch task", e.getCause());
        }
    }

    ArtistFetchOutcome processArtist(String artistId, LocalDate cutoffDate, boolean forceRefresh, RunControl control) {
        metricsService.incrementActiveArtistFetches();
        try {
            if (!forceRefresh) {
                CachedReleases cached = releaseCacheService.get(artistId, cutoffDate);
                if (cached.isFresh()) {
                    log.debug("Artist {} served from cache ({} release(s))", artistId, cached.releases().size());
                    return ArtistFetchOutcome.cached(artistId, cached.releases());
                }
            }
            List<FetchedTrack> fetched = catalogFetcher.fetch(artistId, cutoffDate, control);
            List<Release> releases = assembleReleases(fetched, cutoffDate);
            List<Release> stored = releaseCacheService.put(artistId, cutoffDate, releases);
            log.info("Artist {}: {} recent release(s) from {} fetched track(s)", artistId, stored.size(), fetched.size());
            return ArtistFetchOutcome.fetched(artistId, stored.stream().sorted(Release.NEWEST_FIRST).toList());
        } catch (RuntimeException e) {
            MissingArtist.Reason reason = ErrorHandlingUtils.categorize(e);
            log.warn("Artist {} failed ({}): {}", artistId, reason, ErrorHandlingUtils.describe(e));
            return ArtistFetchOutcome.failed(artistId, reason, ErrorHandlingUtils.describe(e));
        } finally {
            metricsService.decrementActiveArtistFetches();
        }
    }

    /**
     * Turns fetched tracks into the artist's release list. Noise is removed before ISRC
     * bookkeeping so a noisy duplicate never hides the clean recording.
     */
    List<Release> assembleReleases(List<FetchedTrack> fetched, LocalDate cutoffDate) {
        Map<String, Release> byIsrc = new LinkedHashMap<>();
        Set<String> originalAlbumIsrcs = new HashSet<>();
        Map<String, Release> withoutIsrc = new LinkedHashMap<>();
        Set<String> seenTrackIds = new HashSet<>();

        for (FetchedTrack track : fetched) {
            Release observed = track.toObservedRelease();
            if (!seenTrackIds.add(observed.trackId())) {
                continue;
            }
            ResolvedRecording resolved = isrcResolver.resolve(
                new RecordingObservation(observed.isrc(), observed.releaseDate(), observed.albumName()));
            Release effective = observed.withEffectiveRelease(resolved.releaseDate(), resolved.albumName());

            if (effective.releaseDate().isBefore(cutoffDate)) {
                log.debug("Dropping {} ('{}'): recording first released {}", effective.trackId(),
                    effective.trackName(), effective.releaseDate());
                continue;
            }
            if (noiseFilter.isNoise(effective.trackName())) {
                continue;
            }
            if (!effective.hasIsrc()) {
                withoutIsrc.put(effective.trackId(), effective);
                continue;
            }

            boolean onOriginalAlbum = observed.albumName() != null && observed.albumName().equals(resolved.albumName());
            String isrc = effective.isrc();
            if (!byIsrc.containsKey(isrc)) {
                byIsrc.put(isrc, effective);
                if (onOriginalAlbum) {
                    originalAlbumIsrcs.add(isrc);
                }
            } else if (onOriginalAlbum && originalAlbumIsrcs.add(isrc)) {
                byIsrc.put(isrc, effective);
            }
        }

        List<Release> releases = new ArrayList<>(byIsrc.values());
        releases.addAll(withoutIsrc.values());
        return releases;
    }
}
