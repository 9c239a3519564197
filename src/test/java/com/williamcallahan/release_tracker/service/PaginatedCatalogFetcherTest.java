package com.williamcallahan.release_tracker.service;

import com.williamcallahan.release_tracker.exception.CatalogApiException;
import com.williamcallahan.release_tracker.model.AlbumType;
import com.williamcallahan.release_tracker.model.FetchedTrack;
import com.williamcallahan.release_tracker.model.RunControl;
import com.williamcallahan.release_tracker.testutil.DiscoveryEngineFixture;
import com.williamcallahan.release_tracker.testutil.FakeCatalogClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PaginatedCatalogFetcherTest {

    private static final LocalDate CUTOFF = LocalDate.of(2024, 3, 1);

    private FakeCatalogClient catalog;
    private DiscoveryEngineFixture fixture;

    @BeforeEach
    void setUp() {
        catalog = new FakeCatalogClient(2);
        fixture = new DiscoveryEngineFixture(catalog);
    }

    @Test
    void fetch_stopsEachGroupAtFirstPageOutsideWindow() {
        catalog.addEntry("ar1", AlbumType.ALBUM, "a1", "Newest Album", LocalDate.of(2024, 6, 1))
            .addEntry("ar1", AlbumType.ALBUM, "a2", "Spring Album", LocalDate.of(2024, 5, 1))
            .addEntry("ar1", AlbumType.ALBUM, "a3", "Old Album", LocalDate.of(2023, 1, 1))
            .addEntry("ar1", AlbumType.ALBUM, "a4", "Older Album", LocalDate.of(2022, 1, 1))
            .addEntry("ar1", AlbumType.ALBUM, "a5", "Oldest Album", LocalDate.of(2021, 1, 1))
            .addEntry("ar1", AlbumType.SINGLE, "s1", "Fresh Single", LocalDate.of(2024, 6, 10))
            .addTrack("a1", "t1", "Opener", "ISRC00000001", 40)
            .addTrack("a1", "t2", "Closer", "ISRC00000002", 30)
            .addTrack("a2", "t3", "Spring", "ISRC00000003", 20)
            .addTrack("s1", "t4", "Fresh", "ISRC00000004", 70);

        List<FetchedTrack> fetched = fixture.fetcher.fetch("ar1", CUTOFF, RunControl.unbounded(fixture.clock));

        assertThat(fetched).extracting(track -> track.track().id()).containsExactly("t1", "t2", "t3", "t4");
        assertThat(catalog.getPageRequests())
            .containsExactly("ar1:album:0", "ar1:album:2", "ar1:single:0", "ar1:compilation:0");
    }

    @Test
    void fetch_singlesAreScannedEvenWhenAlbumsAreAllOld() {
        catalog.addEntry("ar1", AlbumType.ALBUM, "a1", "Old Album", LocalDate.of(2020, 1, 1))
            .addEntry("ar1", AlbumType.SINGLE, "s1", "New Single", LocalDate.of(2024, 5, 1))
            .addTrack("s1", "t1", "New Single", "ISRC00000001", 55);

        List<FetchedTrack> fetched = fixture.fetcher.fetch("ar1", CUTOFF, RunControl.unbounded(fixture.clock));

        assertThat(fetched).extracting(track -> track.track().id()).containsExactly("t1");
        assertThat(catalog.callCount("getEntryTracks")).isEqualTo(1);
    }

    @Test
    void fetch_continuesPastPageWithMixedEntries() {
        catalog.addEntry("ar1", AlbumType.SINGLE, "s1", "In Window", LocalDate.of(2024, 4, 1))
            .addEntry("ar1", AlbumType.SINGLE, "s2", "Out Of Window", LocalDate.of(2024, 1, 1))
            .addEntry("ar1", AlbumType.SINGLE, "s3", "Way Out", LocalDate.of(2023, 1, 1))
            .addTrack("s1", "t1", "In Window", null, 10);

        fixture.fetcher.fetch("ar1", CUTOFF, RunControl.unbounded(fixture.clock));

        assertThat(catalog.getPageRequests()).contains("ar1:single:0", "ar1:single:2");
        assertThat(catalog.callCount("getEntryTracks")).isEqualTo(1);
    }

    @Test
    void fetch_skipsEntriesWithUnparseableDate() {
        catalog.addEntry("ar1", AlbumType.ALBUM, "bad", "Undated", null)
            .addEntry("ar1", AlbumType.ALBUM, "good", "Dated", LocalDate.of(2024, 4, 1))
            .addTrack("bad", "t0", "Undated Track", "ISRC00000000", 10)
            .addTrack("good", "t1", "Dated Track", "ISRC00000001", 10);

        List<FetchedTrack> fetched = fixture.fetcher.fetch("ar1", CUTOFF, RunControl.unbounded(fixture.clock));

        assertThat(fetched).extracting(track -> track.entry().id()).containsExactly("good");
    }

    @Test
    void fetch_skipsAlternateVersionEntriesWithoutLookingUpTheirTracks() {
        catalog.addEntry("ar1", AlbumType.ALBUM, "live", "Live at Wembley", LocalDate.of(2024, 6, 1))
            .addEntry("ar1", AlbumType.ALBUM, "studio", "Studio Album", LocalDate.of(2024, 5, 1))
            .addEntry("ar1", AlbumType.ALBUM, "older", "Studio Album II", LocalDate.of(2024, 4, 1))
            .addTrack("live", "t-live", "Plain Title", "ISRC00000010", 90)
            .addTrack("studio", "t1", "Plain Title", "ISRC00000011", 40)
            .addTrack("older", "t2", "Another Title", "ISRC00000012", 30);

        List<FetchedTrack> fetched = fixture.fetcher.fetch("ar1", CUTOFF, RunControl.unbounded(fixture.clock));

        assertThat(fetched).extracting(track -> track.track().id()).containsExactly("t1", "t2");
        assertThat(catalog.callCount("getEntryTracks")).isEqualTo(2);
        assertThat(catalog.callCount("getTrackDetail")).isEqualTo(2);
        assertThat(catalog.getPageRequests()).contains("ar1:album:0", "ar1:album:2");
    }

    @Test
    void fetch_cancelledRunMakesNoCalls() {
        catalog.addEntry("ar1", AlbumType.ALBUM, "a1", "Album", LocalDate.of(2024, 6, 1));
        RunControl control = RunControl.unbounded(fixture.clock);
        control.cancel();

        assertThatThrownBy(() -> fixture.fetcher.fetch("ar1", CUTOFF, control))
            .isInstanceOf(CancellationException.class);
        assertThat(catalog.totalCalls()).isZero();
    }

    @Test
    void fetch_propagatesPermanentUpstreamFailure() {
        catalog.failArtist("ar1", CatalogApiException.permanent("Artist not found"));

        assertThatThrownBy(() -> fixture.fetcher.fetch("ar1", CUTOFF, RunControl.unbounded(fixture.clock)))
            .isInstanceOfSatisfying(CatalogApiException.class,
                e -> assertThat(e.getKind()).isEqualTo(CatalogApiException.Kind.PERMANENT));
        assertThat(catalog.callCount("listCatalogEntries")).isEqualTo(1);
    }
}
