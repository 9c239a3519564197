/**
 * Catalog client backed by the Spotify Web API
 *
 * @author William Callahan
 *
 * Features:
 * - Lists an artist's albums one include-group at a time with offset pagination
 * - Reads album track listings, following the API's own paging
 * - Fetches track details (ISRC, popularity, canonical URL)
 * - Finds the earliest album carrying an ISRC through track search
 * - Translates HTTP failures into rate-limited, transient or permanent errors
 */
package com.williamcallahan.release_tracker.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.release_tracker.exception.CatalogApiException;
import com.williamcallahan.release_tracker.model.AlbumType;
import com.williamcallahan.release_tracker.model.CatalogEntry;
import com.williamcallahan.release_tracker.model.CatalogPage;
import com.williamcallahan.release_tracker.model.CatalogTrack;
import com.williamcallahan.release_tracker.model.DatePrecision;
import com.williamcallahan.release_tracker.model.EarliestAppearance;
import com.williamcallahan.release_tracker.model.TrackDetail;
import com.williamcallahan.release_tracker.util.ExternalApiLogger;
import com.williamcallahan.release_tracker.util.ReleaseDates;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Component
@Slf4j
public class SpotifyCatalogClient implements CatalogClient {

    private static final Duration CALL_TIMEOUT = Duration.ofSeconds(15);
    private static final int TRACK_PAGE_LIMIT = 50;
    private static final int SEARCH_LIMIT = 50;

    private final WebClient webClient;
    private final ClientCredentialsTokenProvider tokenProvider;
    private final String baseUrl;
    private final int pageSize;

    public SpotifyCatalogClient(WebClient.Builder webClientBuilder,
                                ClientCredentialsTokenProvider tokenProvider,
                                @Value("${catalog.api.base-url}") String baseUrl,
                                @Value("${app.discovery.page-size:50}") int pageSize) {
        this.webClient = webClientBuilder.build();
        this.tokenProvider = tokenProvider;
        this.baseUrl = baseUrl;
        this.pageSize = pageSize;
    }

    @Override
    public CatalogPage listCatalogEntries(String artistId, AlbumType type, int offset) {
        String url = UriComponentsBuilder.fromUriString(baseUrl)
            .pathSegment("artists", artistId, "albums")
            .queryParam("include_groups", type.apiValue())
            .queryParam("limit", pageSize)
            .queryParam("offset", offset)
            .build()
            .toUriString();
        JsonNode body = getJson(url, "artists/albums");

        List<CatalogEntry> entries = new ArrayList<>();
        for (JsonNode item : body.path("items")) {
            String rawDate = item.path("release_date").asText(null);
            LocalDate releaseDate = ReleaseDates.parse(rawDate).orElse(null);
            DatePrecision precision = ReleaseDates.precisionOf(rawDate, item.path("release_date_precision").asText(null));
            entries.add(new CatalogEntry(
                item.path("id").asText(),
                item.path("name").asText(""),
                type,
                releaseDate,
                precision,
                artistId
            ));
        }
        Integer nextOffset = body.hasNonNull("next") ? offset + body.path("items").size() : null;
        return new CatalogPage(entries, nextOffset);
    }

    @Override
    public List<CatalogTrack> getEntryTracks(String entryId) {
        List<CatalogTrack> tracks = new ArrayList<>();
        int offset = 0;
        while (true) {
            String url = UriComponentsBuilder.fromUriString(baseUrl)
                .pathSegment("albums", entryId, "tracks")
                .queryParam("limit", TRACK_PAGE_LIMIT)
                .queryParam("offset", offset)
                .build()
                .toUriString();
            JsonNode body = getJson(url, "albums/tracks");
            JsonNode items = body.path("items");
            for (JsonNode item : items) {
                tracks.add(new CatalogTrack(item.path("id").asText(), item.path("name").asText("")));
            }
            if (!body.hasNonNull("next") || items.isEmpty()) {
                return tracks;
            }
            offset += items.size();
        }
    }

    @Override
    public TrackDetail getTrackDetail(String trackId) {
        String url = UriComponentsBuilder.fromUriString(baseUrl)
            .pathSegment("tracks", trackId)
            .build()
            .toUriString();
        JsonNode body = getJson(url, "tracks");
        String isrc = body.path("external_ids").path("isrc").asText(null);
        return new TrackDetail(
            isrc == null || isrc.isBlank() ? null : isrc,
            body.path("popularity").asInt(0),
            body.path("external_urls").path("spotify").asText(null)
        );
    }

    @Override
    public Optional<EarliestAppearance> findEarliestByIsrc(String isrc) {
        String url = UriComponentsBuilder.fromUriString(baseUrl)
            .pathSegment("search")
            .queryParam("q", "isrc:" + isrc)
            .queryParam("type", "track")
            .queryParam("limit", SEARCH_LIMIT)
            .build()
            .toUriString();
        JsonNode body = getJson(url, "search/isrc");

        EarliestAppearance earliest = null;
        for (JsonNode item : body.path("tracks").path("items")) {
            JsonNode album = item.path("album");
            Optional<LocalDate> date = ReleaseDates.parse(album.path("release_date").asText(null));
            if (date.isEmpty()) {
                continue;
            }
            if (earliest == null || date.get().isBefore(earliest.releaseDate())) {
                earliest = new EarliestAppearance(date.get(), album.path("name").asText(""));
            }
        }
        return Optional.ofNullable(earliest);
    }

    private JsonNode getJson(String url, String endpoint) {
        ExternalApiLogger.logHttpRequest(log, "GET", url);
        try {
            JsonNode body = webClient.get()
                .uri(url)
                .headers(headers -> headers.setBearerAuth(tokenProvider.getAccessToken()))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(CALL_TIMEOUT)
                .block();
            if (body == null) {
                throw CatalogApiException.transientFailure(endpoint + " returned an empty body", null);
            }
            ExternalApiLogger.logHttpResponse(log, HttpStatus.OK.value(), url);
            return body;
        } catch (RuntimeException e) {
            if (e instanceof WebClientResponseException wcre && wcre.getStatusCode().value() == 401) {
                tokenProvider.invalidate();
            }
            throw CatalogErrorTranslator.translate(e, endpoint);
        }
    }
}
