package com.williamcallahan.release_tracker.service;

import com.williamcallahan.release_tracker.model.AlbumType;
import com.williamcallahan.release_tracker.model.Release;
import com.williamcallahan.release_tracker.testutil.DiscoveryEngineFixture;
import com.williamcallahan.release_tracker.testutil.FakeCatalogClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CacheMaintenanceServiceTest {

    private static final LocalDate CUTOFF = LocalDate.of(2024, 3, 1);

    private DiscoveryEngineFixture fixture;
    private CacheMaintenanceService maintenance;

    @BeforeEach
    void setUp() {
        fixture = new DiscoveryEngineFixture(new FakeCatalogClient(50));
        maintenance = new CacheMaintenanceService(fixture.releaseRepository, fixture.fetchLogRepository,
            fixture.ttlPolicy, fixture.clock);
    }

    @Test
    void purgeReleasesFetchedBefore_deletesOnlyOldRows() {
        fixture.cacheService.put("ar1", CUTOFF, List.of(release("ar1", "t-old")));
        fixture.clock.advance(Duration.ofDays(20));
        fixture.cacheService.put("ar2", CUTOFF, List.of(release("ar2", "t-new")));

        int deleted = maintenance.purgeReleasesFetchedBefore(Duration.ofDays(10));

        assertThat(deleted).isEqualTo(1);
        assertThat(fixture.releaseRepository.findByArtistSince("ar2", CUTOFF)).extracting(Release::trackId)
            .containsExactly("t-new");
    }

    @Test
    void purgeReleasesFetchedBefore_rejectsAgeShorterThanLongestTtl() {
        assertThatThrownBy(() -> maintenance.purgeReleasesFetchedBefore(Duration.ofHours(24)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void clearArtist_removesReleasesAndFetchLog() {
        fixture.cacheService.put("ar1", CUTOFF, List.of(release("ar1", "t1"), release("ar1", "t2")));
        fixture.cacheService.put("ar2", CUTOFF, List.of(release("ar2", "t3")));

        assertThat(maintenance.clearArtist("ar1")).isEqualTo(2);

        assertThat(fixture.fetchLogRepository.find("ar1")).isEmpty();
        assertThat(fixture.cacheService.get("ar1", CUTOFF).stale()).isTrue();
        assertThat(fixture.releaseRepository.size()).isEqualTo(1);
    }

    private static Release release(String artistId, String trackId) {
        return new Release(artistId, "album-" + trackId, trackId, null, LocalDate.of(2024, 5, 1), "Album",
            "Track " + trackId, AlbumType.ALBUM, 10, "https://open.example/track/" + trackId, null);
    }
}
