package com.williamcallahan.release_tracker.client;

import com.williamcallahan.release_tracker.model.AlbumType;
import com.williamcallahan.release_tracker.model.CatalogPage;
import com.williamcallahan.release_tracker.model.CatalogTrack;
import com.williamcallahan.release_tracker.model.EarliestAppearance;
import com.williamcallahan.release_tracker.model.TrackDetail;

import java.util.List;
import java.util.Optional;

/**
 * Upstream music catalog as seen by the discovery engine.
 * Every method is blocking and reports failures as
 * {@link com.williamcallahan.release_tracker.exception.CatalogApiException}.
 */
public interface CatalogClient {

    /**
     * Lists one page of an artist's catalog entries of the given type, newest first.
     */
    CatalogPage listCatalogEntries(String artistId, AlbumType type, int offset);

    List<CatalogTrack> getEntryTracks(String entryId);

    TrackDetail getTrackDetail(String trackId);

    /**
     * Looks up the earliest catalog appearance of a recording.
     *
     * @return empty when the catalog knows no release carrying the ISRC
     */
    Optional<EarliestAppearance> findEarliestByIsrc(String isrc);
}
