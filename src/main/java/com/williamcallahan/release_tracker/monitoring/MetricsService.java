/**
 * Service for tracking discovery metrics and operational health
 * Provides counters, gauges, and timers for monitoring
 *
 * @author William Callahan
 */

package com.williamcallahan.release_tracker.monitoring;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicInteger;

@Service
public class MetricsService {

    private final MeterRegistry meterRegistry;

    // Counters
    private final Counter apiRateLimits;
    private final Counter apiRetries;
    private final Counter cacheHits;
    private final Counter cacheMisses;
    private final Counter cacheCorruptions;

    // Gauges
    private final AtomicInteger activeArtistFetches = new AtomicInteger(0);

    // Timers
    private final Timer apiCallTimer;

    public MetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.apiRateLimits = Counter.builder("catalog.api.rate_limits")
            .description("Number of upstream rate limit responses")
            .register(meterRegistry);

        this.apiRetries = Counter.builder("catalog.api.retries")
            .description("Number of retried upstream calls")
            .register(meterRegistry);

        this.cacheHits = Counter.builder("release.cache.hits")
            .description("Artists served from the release cache")
            .register(meterRegistry);

        this.cacheMisses = Counter.builder("release.cache.misses")
            .description("Artists refetched because the release cache was stale")
            .register(meterRegistry);

        this.cacheCorruptions = Counter.builder("release.cache.corruptions")
            .description("Cache reads that failed to map stored rows")
            .register(meterRegistry);

        Gauge.builder("discovery.artists.active", activeArtistFetches, AtomicInteger::get)
            .description("Number of artists currently being processed")
            .register(meterRegistry);

        this.apiCallTimer = Timer.builder("catalog.api.call.duration")
            .description("Upstream catalog call duration")
            .register(meterRegistry);
    }

    // Counter methods
    public void incrementApiRateLimit() {
        apiRateLimits.increment();
    }

    public void incrementApiRetry() {
        apiRetries.increment();
    }

    public void incrementCacheHit() {
        cacheHits.increment();
    }

    public void incrementCacheMiss() {
        cacheMisses.increment();
    }

    public void incrementCacheCorruption() {
        cacheCorruptions.increment();
    }

    // Gauge methods
    public void incrementActiveArtistFetches() {
        activeArtistFetches.incrementAndGet();
    }

    public void decrementActiveArtistFetches() {
        activeArtistFetches.decrementAndGet();
    }

    public int getActiveArtistFetches() {
        return activeArtistFetches.get();
    }

    // Timer methods
    public Timer.Sample startApiTimer() {
        return Timer.start(meterRegistry);
    }

    public void stopApiTimer(Timer.Sample sample) {
        sample.stop(apiCallTimer);
    }
}
