/**
 * Walks an artist's catalog, one album group at a time, down to the cutoff date
 *
 * @author William Callahan
 *
 * Features:
 * - Independent cursor per album group; stopping one group never stops another
 * - Stops a group at the first page with no entry inside the window
 * - Skips entries titled as alternate versions before paying for their tracks
 * - Looks up tracks and track details for every other entry inside the window
 * - Checks for run cancellation before every page and every entry
 */
package com.williamcallahan.release_tracker.service;

import com.williamcallahan.release_tracker.client.CatalogClient;
import com.williamcallahan.release_tracker.config.AppConfigurationProperties;
import com.williamcallahan.release_tracker.model.AlbumType;
import com.williamcallahan.release_tracker.model.CatalogEntry;
import com.williamcallahan.release_tracker.model.CatalogPage;
import com.williamcallahan.release_tracker.model.CatalogTrack;
import com.williamcallahan.release_tracker.model.FetchCursor;
import com.williamcallahan.release_tracker.model.FetchedTrack;
import com.williamcallahan.release_tracker.model.RunControl;
import com.williamcallahan.release_tracker.model.TrackDetail;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

@Service
@Slf4j
public class PaginatedCatalogFetcher {

    static final String LIST_ENTRIES = "listCatalogEntries";
    static final String ENTRY_TRACKS = "getEntryTracks";
    static final String TRACK_DETAIL = "getTrackDetail";

    private final CatalogClient catalogClient;
    private final CatalogRetryPolicy retryPolicy;
    private final List<AlbumType> albumTypes;
    private final NoiseFilter noiseFilter;

    @Autowired
    public PaginatedCatalogFetcher(CatalogClient catalogClient,
                                   CatalogRetryPolicy retryPolicy,
                                   AppConfigurationProperties properties,
                                   NoiseFilter noiseFilter) {
        this(catalogClient, retryPolicy, properties.getDiscovery().getAlbumTypes().stream()
            .map(AlbumType::fromApiValue)
            .toList(), noiseFilter);
    }

    public PaginatedCatalogFetcher(CatalogClient catalogClient, CatalogRetryPolicy retryPolicy,
                                   List<AlbumType> albumTypes, NoiseFilter noiseFilter) {
        this.catalogClient = catalogClient;
        this.retryPolicy = retryPolicy;
        this.albumTypes = List.copyOf(albumTypes);
        this.noiseFilter = noiseFilter;
    }

    /**
     * Collects every track of every catalog entry released on or after {@code cutoffDate}.
     *
     * @throws CancellationException when the run is cancelled or its deadline passes
     * @throws com.williamcallahan.release_tracker.exception.CatalogApiException when an upstream call fails for good
     */
    public List<FetchedTrack> fetch(String artistId, LocalDate cutoffDate, RunControl control) {
        List<FetchedTrack> fetched = new ArrayList<>();
        for (AlbumType type : albumTypes) {
            FetchCursor cursor = new FetchCursor(type);
            while (cursor.isScanning()) {
                ensureNotCancelled(control, artistId);
                int offset = cursor.getNextOffset();
                CatalogPage page = retryPolicy.execute(LIST_ENTRIES,
                    () -> catalogClient.listCatalogEntries(artistId, type, offset));
                boolean anyInWindow = false;
                for (CatalogEntry entry : page.entries()) {
                    ensureNotCancelled(control, artistId);
                    if (!entry.hasReleaseDate()) {
                        log.warn("Skipping catalog entry {} ('{}') of artist {}: unparseable release date",
                            entry.id(), entry.name(), artistId);
                        continue;
                    }
                    if (!entry.isOnOrAfter(cutoffDate)) {
                        continue;
                    }
                    anyInWindow = true;
                    if (noiseFilter.isNoise(entry.name())) {
                        log.debug("Skipping catalog entry {} ('{}') of artist {}: alternate version",
                            entry.id(), entry.name(), artistId);
                        continue;
                    }
                    collectTracks(entry, fetched);
                }
                cursor.advance(page, anyInWindow);
            }
            log.debug("Artist {} {} scan finished: {}", artistId, type.apiValue(), cursor);
        }
        return fetched;
    }

    private void collectTracks(CatalogEntry entry, List<FetchedTrack> sink) {
        List<CatalogTrack> tracks = retryPolicy.execute(ENTRY_TRACKS, () -> catalogClient.getEntryTracks(entry.id()));
        for (CatalogTrack track : tracks) {
            TrackDetail detail = retryPolicy.execute(TRACK_DETAIL, () -> catalogClient.getTrackDetail(track.id()));
            sink.add(new FetchedTrack(entry, track, detail));
        }
    }

    private static void ensureNotCancelled(RunControl control, String artistId) {
        if (control != null && control.isCancelled()) {
            throw new CancellationException("Run cancelled while fetching artist " + artistId);
        }
    }
}
