package com.williamcallahan.release_tracker.testutil;

import com.williamcallahan.release_tracker.client.CatalogClient;
import com.williamcallahan.release_tracker.exception.CatalogApiException;
import com.williamcallahan.release_tracker.model.AlbumType;
import com.williamcallahan.release_tracker.model.CatalogEntry;
import com.williamcallahan.release_tracker.model.CatalogPage;
import com.williamcallahan.release_tracker.model.CatalogTrack;
import com.williamcallahan.release_tracker.model.DatePrecision;
import com.williamcallahan.release_tracker.model.EarliestAppearance;
import com.williamcallahan.release_tracker.model.TrackDetail;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory catalog with offset pagination, failure injection and call counting.
 * Entries must be added newest first, as the real catalog lists them.
 */
public class FakeCatalogClient implements CatalogClient {

    private final int pageSize;
    private final Map<String, List<CatalogEntry>> entriesByArtistAndType = new ConcurrentHashMap<>();
    private final Map<String, List<CatalogTrack>> tracksByEntry = new ConcurrentHashMap<>();
    private final Map<String, TrackDetail> detailsByTrack = new ConcurrentHashMap<>();
    private final Map<String, EarliestAppearance> earliestByIsrc = new ConcurrentHashMap<>();
    private final Map<String, RuntimeException> artistFailures = new ConcurrentHashMap<>();
    private final Map<String, CountDownLatch> artistGates = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> callsByOperation = new ConcurrentHashMap<>();
    private final List<String> pageRequests = new CopyOnWriteArrayList<>();

    public FakeCatalogClient(int pageSize) {
        this.pageSize = pageSize;
    }

    public FakeCatalogClient addEntry(String artistId, AlbumType type, String entryId, String name, LocalDate releaseDate) {
        CatalogEntry entry = new CatalogEntry(entryId, name, type, releaseDate,
            releaseDate == null ? null : DatePrecision.DAY, artistId);
        entriesByArtistAndType.computeIfAbsent(key(artistId, type), k -> new CopyOnWriteArrayList<>()).add(entry);
        tracksByEntry.putIfAbsent(entryId, new CopyOnWriteArrayList<>());
        return this;
    }

    public FakeCatalogClient addTrack(String entryId, String trackId, String name, String isrc, int popularity) {
        tracksByEntry.computeIfAbsent(entryId, k -> new CopyOnWriteArrayList<>()).add(new CatalogTrack(trackId, name));
        detailsByTrack.put(trackId, new TrackDetail(isrc, popularity, "https://open.example/track/" + trackId));
        return this;
    }

    public FakeCatalogClient earliest(String isrc, LocalDate releaseDate, String albumName) {
        earliestByIsrc.put(isrc, new EarliestAppearance(releaseDate, albumName));
        return this;
    }

    public FakeCatalogClient failArtist(String artistId, RuntimeException failure) {
        artistFailures.put(artistId, failure);
        return this;
    }

    /**
     * Makes catalog listing for the artist block until the latch is released.
     */
    public FakeCatalogClient gateArtist(String artistId, CountDownLatch gate) {
        artistGates.put(artistId, gate);
        return this;
    }

    @Override
    public CatalogPage listCatalogEntries(String artistId, AlbumType type, int offset) {
        count("listCatalogEntries");
        pageRequests.add(artistId + ":" + type.apiValue() + ":" + offset);
        CountDownLatch gate = artistGates.get(artistId);
        if (gate != null) {
            try {
                gate.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw CatalogApiException.transientFailure("interrupted", e);
            }
        }
        RuntimeException failure = artistFailures.get(artistId);
        if (failure != null) {
            throw failure;
        }
        List<CatalogEntry> all = entriesByArtistAndType.getOrDefault(key(artistId, type), List.of());
        if (offset >= all.size()) {
            return CatalogPage.last(List.of());
        }
        int end = Math.min(all.size(), offset + pageSize);
        List<CatalogEntry> page = new ArrayList<>(all.subList(offset, end));
        return new CatalogPage(page, end < all.size() ? end : null);
    }

    @Override
    public List<CatalogTrack> getEntryTracks(String entryId) {
        count("getEntryTracks");
        return List.copyOf(tracksByEntry.getOrDefault(entryId, List.of()));
    }

    @Override
    public TrackDetail getTrackDetail(String trackId) {
        count("getTrackDetail");
        TrackDetail detail = detailsByTrack.get(trackId);
        if (detail == null) {
            throw CatalogApiException.permanent("Unknown track " + trackId);
        }
        return detail;
    }

    @Override
    public Optional<EarliestAppearance> findEarliestByIsrc(String isrc) {
        count("findEarliestByIsrc");
        return Optional.ofNullable(earliestByIsrc.get(isrc));
    }

    public int callCount(String operation) {
        AtomicInteger calls = callsByOperation.get(operation);
        return calls == null ? 0 : calls.get();
    }

    public int totalCalls() {
        return callsByOperation.values().stream().mapToInt(AtomicInteger::get).sum();
    }

    public List<String> getPageRequests() {
        return List.copyOf(pageRequests);
    }

    private void count(String operation) {
        callsByOperation.computeIfAbsent(operation, k -> new AtomicInteger()).incrementAndGet();
    }

    private static String key(String artistId, AlbumType type) {
        return artistId + "|" + type.apiValue();
    }
}
