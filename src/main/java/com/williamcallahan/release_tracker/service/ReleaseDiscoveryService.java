/**
 * Entry point of the release discovery engine
 *
 * @author William Callahan
 *
 * Features:
 * - Verifies the store before doing any work
 * - Delegates per-artist work to the FetchOrchestrator
 * - Reports a recording shared by several requested artists once, under the first of them
 * - Applies the optional popularity cap per artist
 * - Reports upstream calls made by the run and records run history
 */
package com.williamcallahan.release_tracker.service;

import com.williamcallahan.release_tracker.config.AppConfigurationProperties;
import com.williamcallahan.release_tracker.model.ArtistFetchOutcome;
import com.williamcallahan.release_tracker.model.DiscoveryRequest;
import com.williamcallahan.release_tracker.model.DiscoveryResult;
import com.williamcallahan.release_tracker.model.MissingArtist;
import com.williamcallahan.release_tracker.model.Release;
import com.williamcallahan.release_tracker.model.RunControl;
import com.williamcallahan.release_tracker.service.cache.ReleaseCacheService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
@Slf4j
public class ReleaseDiscoveryService {

    private final ReleaseCacheService releaseCacheService;
    private final FetchOrchestrator fetchOrchestrator;
    private final PopularityRanker popularityRanker;
    private final ApiRequestMonitor apiRequestMonitor;
    private final RunHistoryService runHistoryService;
    private final Clock clock;
    private final int defaultLookbackDays;

    @Autowired
    public ReleaseDiscoveryService(ReleaseCacheService releaseCacheService,
                                   FetchOrchestrator fetchOrchestrator,
                                   PopularityRanker popularityRanker,
                                   ApiRequestMonitor apiRequestMonitor,
                                   RunHistoryService runHistoryService,
                                   Clock clock,
                                   AppConfigurationProperties properties) {
        this(releaseCacheService, fetchOrchestrator, popularityRanker, apiRequestMonitor, runHistoryService, clock,
            properties.getDiscovery().getLookbackDays());
    }

    public ReleaseDiscoveryService(ReleaseCacheService releaseCacheService,
                                   FetchOrchestrator fetchOrchestrator,
                                   PopularityRanker popularityRanker,
                                   ApiRequestMonitor apiRequestMonitor,
                                   RunHistoryService runHistoryService,
                                   Clock clock,
                                   int defaultLookbackDays) {
        this.releaseCacheService = releaseCacheService;
        this.fetchOrchestrator = fetchOrchestrator;
        this.popularityRanker = popularityRanker;
        this.apiRequestMonitor = apiRequestMonitor;
        this.runHistoryService = runHistoryService;
        this.clock = clock;
        this.defaultLookbackDays = defaultLookbackDays;
    }

    /**
     * Discovers releases of the last {@code app.discovery.lookback-days} days, using the cache where fresh.
     */
    public DiscoveryResult discoverRecent(List<String> artistIds) {
        return discover(DiscoveryRequest.of(artistIds, cutoffForLookback(defaultLookbackDays)));
    }

    /**
     * First day of a window ending today (UTC) and spanning {@code lookbackDays} days.
     */
    public LocalDate cutoffForLookback(int lookbackDays) {
        if (lookbackDays < 0) {
            throw new IllegalArgumentException("lookbackDays must not be negative, got " + lookbackDays);
        }
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC).minusDays(lookbackDays);
    }

    /**
     * Discovers recent releases for the requested artists.
     *
     * @param request artists, window, refresh flag, cap and optional deadline
     * @return releases per artist, the artists that failed and the upstream calls made
     * @throws com.williamcallahan.release_tracker.exception.CacheStoreUnavailableException when the store is unreachable
     */
    public DiscoveryResult discover(DiscoveryRequest request) {
        Instant startedAt = clock.instant();
        releaseCacheService.verifyAvailable();

        List<String> artistIds = new ArrayList<>(new LinkedHashSet<>(request.artistIds().stream()
            .filter(id -> id != null && !id.isBlank())
            .map(String::trim)
            .toList()));
        log.info("Discovering releases since {} for {} artist(s){}", request.cutoffDate(), artistIds.size(),
            request.forceRefresh() ? " (forced refresh)" : "");

        Map<String, Long> callsBefore = apiRequestMonitor.snapshotEndpointCounts();
        RunControl control = RunControl.withTimeout(clock, request.timeout());
        Map<String, ArtistFetchOutcome> outcomes = artistIds.isEmpty()
            ? Map.of()
            : fetchOrchestrator.run(artistIds, request.cutoffDate(), request.forceRefresh(), control);

        Map<String, List<Release>> releasesByArtist = new LinkedHashMap<>();
        List<MissingArtist> missingArtists = new ArrayList<>();
        Set<String> reportedIsrcs = new HashSet<>();
        Set<String> reportedTracks = new HashSet<>();
        for (String artistId : artistIds) {
            ArtistFetchOutcome outcome = outcomes.get(artistId);
            if (outcome == null) {
                missingArtists.add(new MissingArtist(artistId, MissingArtist.Reason.UNEXPECTED_ERROR, "No outcome recorded"));
                continue;
            }
            if (outcome.isFailure()) {
                missingArtists.add(outcome.failure());
                continue;
            }
            List<Release> unique = new ArrayList<>();
            for (Release release : outcome.releases()) {
                boolean duplicate = !reportedTracks.add(release.trackId())
                    || (release.hasIsrc() && !reportedIsrcs.add(release.isrc()));
                if (!duplicate) {
                    unique.add(release);
                }
            }
            releasesByArtist.put(artistId, popularityRanker.cap(unique, request.maxPerArtist()));
        }

        Map<String, Long> callCounts = ApiRequestMonitor.delta(callsBefore, apiRequestMonitor.snapshotEndpointCounts());
        DiscoveryResult result = new DiscoveryResult(releasesByArtist, missingArtists, callCounts);

        Duration duration = Duration.between(startedAt, clock.instant());
        int lookbackDays = (int) ChronoUnit.DAYS.between(request.cutoffDate(), LocalDate.ofInstant(startedAt, ZoneOffset.UTC));
        runHistoryService.recordRun(startedAt, artistIds.size(), lookbackDays, result, duration);

        log.info("Discovery finished: {} release(s) for {} artist(s), {} missing, {} upstream call(s) in {}ms",
            result.totalReleases(), releasesByArtist.size(), missingArtists.size(), result.totalCalls(), duration.toMillis());
        return result;
    }
}
