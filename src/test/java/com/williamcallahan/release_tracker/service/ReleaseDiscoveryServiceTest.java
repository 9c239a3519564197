package com.williamcallahan.release_tracker.service;

import com.williamcallahan.release_tracker.exception.CacheStoreUnavailableException;
import com.williamcallahan.release_tracker.exception.CatalogApiException;
import com.williamcallahan.release_tracker.model.AlbumType;
import com.williamcallahan.release_tracker.model.DiscoveryRequest;
import com.williamcallahan.release_tracker.model.DiscoveryResult;
import com.williamcallahan.release_tracker.model.MissingArtist;
import com.williamcallahan.release_tracker.model.Release;
import com.williamcallahan.release_tracker.model.RunRecord;
import com.williamcallahan.release_tracker.service.cache.ReleaseCacheService;
import com.williamcallahan.release_tracker.testutil.DiscoveryEngineFixture;
import com.williamcallahan.release_tracker.testutil.FakeCatalogClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class ReleaseDiscoveryServiceTest {

    private static final LocalDate CUTOFF = LocalDate.of(2024, 3, 1);

    private FakeCatalogClient catalog;
    private DiscoveryEngineFixture fixture;

    @BeforeEach
    void setUp() {
        catalog = new FakeCatalogClient(50)
            .addEntry("ar1", AlbumType.ALBUM, "a1", "Second Record", LocalDate.of(2024, 5, 10))
            .addTrack("a1", "t1", "Quiet Song", "USX000000101", 15)
            .addTrack("a1", "t2", "Loud Song", "USX000000102", 85)
            .addEntry("ar2", AlbumType.SINGLE, "s2", "Solo Single", LocalDate.of(2024, 6, 1))
            .addTrack("s2", "t3", "Solo", "USX000000103", 50);
        fixture = new DiscoveryEngineFixture(catalog);
    }

    @Test
    void discover_secondRunIsServedFromCacheWithIdenticalResult() {
        DiscoveryRequest request = DiscoveryRequest.of(List.of("ar1", "ar2"), CUTOFF);

        DiscoveryResult first = fixture.discoveryService.discover(request);
        int callsAfterFirst = catalog.totalCalls();
        DiscoveryResult second = fixture.discoveryService.discover(request);

        assertThat(second.releasesByArtist()).isEqualTo(first.releasesByArtist());
        assertThat(second.callCounts()).isEmpty();
        assertThat(catalog.totalCalls()).isEqualTo(callsAfterFirst);
    }

    @Test
    void discover_reportsUpstreamCallsByOperation() {
        DiscoveryResult result = fixture.discoveryService.discover(DiscoveryRequest.of(List.of("ar2"), CUTOFF));

        assertThat(result.callCounts()).isEqualTo(Map.of(
            "listCatalogEntries", 3L,
            "getEntryTracks", 1L,
            "getTrackDetail", 1L,
            "findEarliestByIsrc", 1L));
        assertThat(result.totalCalls()).isEqualTo(6L);
        assertThat(result.releasesByArtist().get("ar2")).extracting(Release::trackId).containsExactly("t3");
    }

    @Test
    void discover_reportsSharedRecordingUnderFirstRequestedArtist() {
        catalog.addEntry("ar3", AlbumType.SINGLE, "feat", "Collab", LocalDate.of(2024, 5, 20))
            .addEntry("ar2", AlbumType.ALBUM, "feat", "Collab", LocalDate.of(2024, 5, 20))
            .addTrack("feat", "t-collab", "Together", "USX000000104", 70);

        DiscoveryResult result = fixture.discoveryService.discover(DiscoveryRequest.of(List.of("ar3", "ar2"), CUTOFF));

        assertThat(result.releasesByArtist().get("ar3")).extracting(Release::trackId).containsExactly("t-collab");
        assertThat(result.releasesByArtist().get("ar2")).extracting(Release::trackId).containsExactly("t3");
    }

    @Test
    void discover_sharedRecordingKeepsItsArtistOnCachedRerun() {
        catalog.addEntry("ar3", AlbumType.SINGLE, "feat", "Collab", LocalDate.of(2024, 5, 20))
            .addEntry("ar2", AlbumType.ALBUM, "feat", "Collab", LocalDate.of(2024, 5, 20))
            .addTrack("feat", "t-collab", "Together", "USX000000104", 70);
        DiscoveryRequest request = DiscoveryRequest.of(List.of("ar3", "ar2"), CUTOFF);

        DiscoveryResult first = fixture.discoveryService.discover(request);
        int callsAfterFirst = catalog.totalCalls();
        DiscoveryResult second = fixture.discoveryService.discover(request);

        assertThat(catalog.totalCalls()).isEqualTo(callsAfterFirst);
        assertThat(second.releasesByArtist()).isEqualTo(first.releasesByArtist());
        assertThat(second.releasesByArtist().get("ar3")).extracting(Release::trackId).containsExactly("t-collab");
        assertThat(second.releasesByArtist().get("ar2")).extracting(Release::trackId).containsExactly("t3");
        assertThat(fixture.releaseRepository.findByArtistSince("ar2", CUTOFF))
            .extracting(Release::trackId).containsExactlyInAnyOrder("t3", "t-collab");
    }

    @Test
    void discover_appliesPopularityCapPerArtist() {
        DiscoveryRequest request = new DiscoveryRequest(List.of("ar1"), CUTOFF, false, 1, null);

        DiscoveryResult result = fixture.discoveryService.discover(request);

        assertThat(result.releasesByArtist().get("ar1")).extracting(Release::trackId).containsExactly("t2");
        // the cache keeps the uncapped list
        assertThat(fixture.releaseRepository.findByArtistSince("ar1", CUTOFF)).hasSize(2);
    }

    @Test
    void discover_listsFailedArtistsAndRecordsPartialRun() {
        catalog.failArtist("broken", CatalogApiException.permanent("Artist not found"));

        DiscoveryResult result = fixture.discoveryService.discover(
            DiscoveryRequest.of(Arrays.asList("ar1", " ar1 ", "", "broken"), CUTOFF));

        assertThat(result.releasesByArtist()).containsOnlyKeys("ar1");
        assertThat(result.missingArtists()).singleElement()
            .satisfies(missing -> {
                assertThat(missing.artistId()).isEqualTo("broken");
                assertThat(missing.reason()).isEqualTo(MissingArtist.Reason.PERMANENT_ERROR);
            });

        RunRecord record = fixture.runHistoryService.recentRuns(1).get(0);
        assertThat(record.status()).isEqualTo(RunHistoryService.STATUS_PARTIAL);
        assertThat(record.artistsTracked()).isEqualTo(2);
        assertThat(record.releasesFound()).isEqualTo(2);
        assertThat(record.lookbackDays()).isEqualTo(106);
        assertThat(record.apiCallsMade()).isEqualTo(result.totalCalls());
    }

    @Test
    void discoverRecent_usesConfiguredLookbackWindow() {
        catalog.addEntry("ar4", AlbumType.SINGLE, "s-recent", "Recent", LocalDate.of(2024, 3, 20))
            .addTrack("s-recent", "t-recent", "Recent", null, 10)
            .addEntry("ar4", AlbumType.SINGLE, "s-old", "Too Old", LocalDate.of(2024, 3, 10))
            .addTrack("s-old", "t-old", "Too Old", null, 10);

        DiscoveryResult result = fixture.discoveryService.discoverRecent(List.of("ar4"));

        assertThat(fixture.discoveryService.cutoffForLookback(90)).isEqualTo(LocalDate.of(2024, 3, 17));
        assertThat(result.releasesByArtist().get("ar4")).extracting(Release::trackId).containsExactly("t-recent");
        assertThat(fixture.runHistoryService.recentRuns(1).get(0).lookbackDays()).isEqualTo(90);
    }

    @Test
    void discover_withNoArtistsMakesNoCalls() {
        DiscoveryResult result = fixture.discoveryService.discover(DiscoveryRequest.of(List.of(), CUTOFF));

        assertThat(result.releasesByArtist()).isEmpty();
        assertThat(result.missingArtists()).isEmpty();
        assertThat(catalog.totalCalls()).isZero();
    }

    @Test
    void discover_failsFastWhenStoreIsUnavailable() {
        ReleaseCacheService cacheService = mock(ReleaseCacheService.class);
        FetchOrchestrator orchestrator = mock(FetchOrchestrator.class);
        doThrow(new CacheStoreUnavailableException("Release cache store is unreachable", null))
            .when(cacheService).verifyAvailable();
        ReleaseDiscoveryService service = new ReleaseDiscoveryService(cacheService, orchestrator, new PopularityRanker(),
            new ApiRequestMonitor(), fixture.runHistoryService, Clock.systemUTC(), 90);

        assertThatThrownBy(() -> service.discover(DiscoveryRequest.of(List.of("ar1"), CUTOFF)))
            .isInstanceOf(CacheStoreUnavailableException.class);
        verify(orchestrator, never()).run(anyList(), any(), anyBoolean(), any());
        assertThat(fixture.runHistoryService.recentRuns(10)).isEmpty();
    }
}
