/**
 * Write-through cache of discovered releases per artist
 *
 * @author William Callahan
 *
 * Features:
 * - Serves an artist's releases for a window when the last fetch still covers it
 * - Tiered TTL by release age, checked per entry and for the fetch itself
 * - Forced invalidation per artist
 * - Corrupt rows degrade to a cache miss instead of failing the artist
 * - Store reachability probe used before a discovery run
 */
package com.williamcallahan.release_tracker.service.cache;

import com.williamcallahan.release_tracker.exception.CacheCorruptionException;
import com.williamcallahan.release_tracker.exception.CacheStoreUnavailableException;
import com.williamcallahan.release_tracker.model.ArtistFetchLog;
import com.williamcallahan.release_tracker.model.CachedReleases;
import com.williamcallahan.release_tracker.model.Release;
import com.williamcallahan.release_tracker.monitoring.MetricsService;
import com.williamcallahan.release_tracker.repository.ArtistFetchLogRepository;
import com.williamcallahan.release_tracker.repository.ReleaseRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

@Service
@Slf4j
public class ReleaseCacheService {

    private final ReleaseRepository releaseRepository;
    private final ArtistFetchLogRepository fetchLogRepository;
    private final ReleaseTtlPolicy ttlPolicy;
    private final MetricsService metricsService;
    private final Clock clock;

    public ReleaseCacheService(ReleaseRepository releaseRepository,
                               ArtistFetchLogRepository fetchLogRepository,
                               ReleaseTtlPolicy ttlPolicy,
                               MetricsService metricsService,
                               Clock clock) {
        this.releaseRepository = releaseRepository;
        this.fetchLogRepository = fetchLogRepository;
        this.ttlPolicy = ttlPolicy;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Returns the artist's cached releases dated on or after {@code cutoffDate}.
     *
     * Only releases confirmed by the artist's latest fetch are returned. Older rows stay in the
     * store as history but are not served.
     *
     * @return the releases and whether the artist must be refetched
     */
    public CachedReleases get(String artistId, LocalDate cutoffDate) {
        Instant now = clock.instant();
        try {
            Optional<ArtistFetchLog> fetchLog = fetchLogRepository.find(artistId);
            if (fetchLog.isEmpty()) {
                log.debug("Release cache miss for artist {}: never fetched", artistId);
                metricsService.incrementCacheMiss();
                return CachedReleases.miss();
            }
            ArtistFetchLog lastFetch = fetchLog.get();
            List<Release> releases = releaseRepository.findByArtistSince(artistId, cutoffDate).stream()
                .filter(release -> !release.fetchedAt().isBefore(lastFetch.fetchedAt()))
                .sorted(Release.NEWEST_FIRST)
                .toList();

            String staleReason = staleReason(artistId, cutoffDate, lastFetch, releases, now);
            if (staleReason != null) {
                log.debug("Release cache stale for artist {}: {}", artistId, staleReason);
                metricsService.incrementCacheMiss();
                return new CachedReleases(releases, true);
            }
            metricsService.incrementCacheHit();
            return new CachedReleases(releases, false);
        } catch (CacheCorruptionException e) {
            log.warn("Corrupt release cache data for artist {}; treating as a miss: {}", artistId, e.getMessage());
            metricsService.incrementCacheCorruption();
            return CachedReleases.miss();
        }
    }

    private String staleReason(String artistId, LocalDate cutoffDate, ArtistFetchLog lastFetch,
                               List<Release> releases, Instant now) {
        if (lastFetch.invalidated()) {
            return "invalidated";
        }
        if (!lastFetch.covers(cutoffDate)) {
            return "cached window starts " + lastFetch.cutoffDate() + ", requested " + cutoffDate;
        }
        for (Release release : releases) {
            if (!ttlPolicy.isFresh(release, now)) {
                return "release " + release.trackId() + " expired";
            }
        }
        Duration logTtl = releaseRepository.findLatestReleaseDate(artistId)
            .map(latest -> ttlPolicy.ttlFor(latest, now))
            .orElse(ttlPolicy.getDefaultTtl());
        if (Duration.between(lastFetch.fetchedAt(), now).compareTo(logTtl) >= 0) {
            return "fetch of " + lastFetch.fetchedAt() + " expired";
        }
        return null;
    }

    /**
     * Stores the artist's releases with {@code fetchedAt = now} and records the fetched window.
     * Releases are written before the fetch log, so a failure in between leaves the artist stale.
     *
     * @return the releases as stored
     */
    public List<Release> put(String artistId, LocalDate cutoffDate, List<Release> releases) {
        // timestamptz precision
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        List<Release> stamped = releases.stream().map(release -> release.withFetchedAt(now)).toList();
        releaseRepository.upsertAll(stamped);
        fetchLogRepository.record(artistId, cutoffDate, now);
        log.debug("Cached {} release(s) for artist {} since {}", stamped.size(), artistId, cutoffDate);
        return stamped;
    }

    /**
     * Makes the next {@link #get} for the artist report stale regardless of TTL.
     */
    public void forceInvalidate(String artistId) {
        fetchLogRepository.invalidate(artistId);
        log.info("Invalidated release cache for artist {}", artistId);
    }

    /**
     * @throws CacheStoreUnavailableException when the backing store cannot be reached
     */
    public void verifyAvailable() {
        try {
            releaseRepository.verifyConnection();
        } catch (DataAccessException e) {
            log.error("Release cache store is unreachable: {}", e.getMessage());
            throw new CacheStoreUnavailableException("Release cache store is unreachable", e);
        }
    }
}
