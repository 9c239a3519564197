package com.williamcallahan.release_tracker.service;

import com.williamcallahan.release_tracker.repository.ArtistFetchLogRepository;
import com.williamcallahan.release_tracker.repository.ReleaseRepository;
import com.williamcallahan.release_tracker.service.cache.ReleaseTtlPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Administrative cache cleanup. The discovery engine itself never deletes cached data.
 */
@Service
@Slf4j
public class CacheMaintenanceService {

    private final ReleaseRepository releaseRepository;
    private final ArtistFetchLogRepository fetchLogRepository;
    private final ReleaseTtlPolicy ttlPolicy;
    private final Clock clock;

    public CacheMaintenanceService(ReleaseRepository releaseRepository,
                                   ArtistFetchLogRepository fetchLogRepository,
                                   ReleaseTtlPolicy ttlPolicy,
                                   Clock clock) {
        this.releaseRepository = releaseRepository;
        this.fetchLogRepository = fetchLogRepository;
        this.ttlPolicy = ttlPolicy;
        this.clock = clock;
    }

    /**
     * Deletes cached releases last confirmed more than {@code maxAge} ago.
     * {@code maxAge} may not be shorter than the longest TTL, so a fresh artist never loses releases.
     *
     * @return number of releases deleted
     */
    public int purgeReleasesFetchedBefore(Duration maxAge) {
        if (maxAge.compareTo(ttlPolicy.getDefaultTtl()) < 0) {
            throw new IllegalArgumentException("maxAge " + maxAge + " is shorter than the longest cache TTL "
                + ttlPolicy.getDefaultTtl());
        }
        Instant threshold = clock.instant().minus(maxAge);
        int deleted = releaseRepository.deleteFetchedBefore(threshold);
        log.info("Purged {} cached release(s) fetched before {}", deleted, threshold);
        return deleted;
    }

    /**
     * Deletes everything cached for one artist, including its fetch log.
     *
     * @return number of releases deleted
     */
    public int clearArtist(String artistId) {
        int deleted = releaseRepository.deleteByArtist(artistId);
        fetchLogRepository.delete(artistId);
        log.info("Cleared {} cached release(s) for artist {}", deleted, artistId);
        return deleted;
    }
}
