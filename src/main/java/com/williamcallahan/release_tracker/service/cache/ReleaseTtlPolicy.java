package com.williamcallahan.release_tracker.service.cache;

import com.williamcallahan.release_tracker.model.Release;
import org.springframework.boot.convert.DurationStyle;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Freshness window of a cached release, by release age.
 * Recent releases change often upstream (track additions, popularity) and are refetched sooner.
 * The TTL never decreases as a release gets older.
 */
public final class ReleaseTtlPolicy {

    /**
     * Releases younger than {@code maxAge} are cached for {@code ttl}.
     */
    public record Tier(Duration maxAge, Duration ttl) {
    }

    private final List<Tier> tiers;
    private final Duration defaultTtl;

    public ReleaseTtlPolicy(List<Tier> tiers, Duration defaultTtl) {
        this.tiers = List.copyOf(tiers);
        this.defaultTtl = defaultTtl;
        validate();
    }

    /**
     * Builds the policy from {@code <maxAge>:<ttl>} strings such as {@code 30d:6h}.
     */
    public static ReleaseTtlPolicy fromConfig(List<String> tierValues, Duration defaultTtl) {
        List<Tier> parsed = new ArrayList<>();
        for (String tier : tierValues) {
            String[] parts = tier.trim().split(":");
            if (parts.length != 2) {
                throw new IllegalArgumentException("TTL tier must look like <maxAge>:<ttl>, got '" + tier + "'");
            }
            parsed.add(new Tier(DurationStyle.detectAndParse(parts[0].trim()), DurationStyle.detectAndParse(parts[1].trim())));
        }
        return new ReleaseTtlPolicy(parsed, defaultTtl);
    }

    public static ReleaseTtlPolicy defaults() {
        return new ReleaseTtlPolicy(
            List.of(new Tier(Duration.ofDays(30), Duration.ofHours(6)), new Tier(Duration.ofDays(180), Duration.ofHours(24))),
            Duration.ofHours(168));
    }

    private void validate() {
        if (defaultTtl == null || defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("Default TTL must be positive");
        }
        Tier previous = null;
        for (Tier tier : tiers) {
            if (tier.ttl().isNegative() || tier.ttl().isZero()) {
                throw new IllegalArgumentException("TTL tier " + tier + " must have a positive TTL");
            }
            if (previous != null && (tier.maxAge().compareTo(previous.maxAge()) <= 0
                || tier.ttl().compareTo(previous.ttl()) < 0)) {
                throw new IllegalArgumentException("TTL tiers must be ordered by age with non-decreasing TTL: " + tiers);
            }
            previous = tier;
        }
        if (previous != null && defaultTtl.compareTo(previous.ttl()) < 0) {
            throw new IllegalArgumentException("Default TTL " + defaultTtl + " is shorter than the last tier " + previous);
        }
    }

    public Duration ttlFor(LocalDate releaseDate, Instant now) {
        Duration age = Duration.between(releaseDate.atStartOfDay().toInstant(ZoneOffset.UTC), now);
        for (Tier tier : tiers) {
            if (age.compareTo(tier.maxAge()) < 0) {
                return tier.ttl();
            }
        }
        return defaultTtl;
    }

    /**
     * A release is fresh iff {@code now - fetchedAt < ttl}.
     */
    public boolean isFresh(Release release, Instant now) {
        return isFresh(release.releaseDate(), release.fetchedAt(), now);
    }

    public boolean isFresh(LocalDate releaseDate, Instant fetchedAt, Instant now) {
        if (fetchedAt == null) {
            return false;
        }
        return Duration.between(fetchedAt, now).compareTo(ttlFor(releaseDate, now)) < 0;
    }

    /**
     * TTL of the oldest tier, used when there is no release to date the artist by.
     */
    public Duration getDefaultTtl() {
        return defaultTtl;
    }
}
