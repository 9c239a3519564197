/**
 * Supplies bearer tokens for the catalog API using the OAuth2 client-credentials grant
 *
 * @author William Callahan
 *
 * Features:
 * - Caches the access token until shortly before it expires
 * - Refreshes under a lock so concurrent workers trigger a single token request
 * - Can be invalidated after an authorization failure
 */
package com.williamcallahan.release_tracker.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.release_tracker.exception.CatalogApiException;
import com.williamcallahan.release_tracker.util.ExternalApiLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@Component
@Slf4j
public class ClientCredentialsTokenProvider {

    private static final Duration EXPIRY_MARGIN = Duration.ofSeconds(60);

    private final WebClient webClient;
    private final Clock clock;
    private final String tokenUrl;
    private final String clientId;
    private final String clientSecret;

    private String accessToken;
    private Instant expiresAt = Instant.EPOCH;

    public ClientCredentialsTokenProvider(WebClient.Builder webClientBuilder,
                                          Clock clock,
                                          @Value("${catalog.api.token-url}") String tokenUrl,
                                          @Value("${catalog.api.client-id:}") String clientId,
                                          @Value("${catalog.api.client-secret:}") String clientSecret) {
        this.webClient = webClientBuilder.build();
        this.clock = clock;
        this.tokenUrl = tokenUrl;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
    }

    /**
     * Returns a valid access token, requesting a new one when the cached token is about to expire.
     */
    public synchronized String getAccessToken() {
        if (accessToken != null && clock.instant().isBefore(expiresAt.minus(EXPIRY_MARGIN))) {
            return accessToken;
        }
        if (clientId == null || clientId.isBlank() || clientSecret == null || clientSecret.isBlank()) {
            throw CatalogApiException.permanent("Catalog API credentials are not configured (catalog.api.client-id/client-secret)");
        }
        ExternalApiLogger.logHttpRequest(log, "POST", tokenUrl);
        JsonNode body;
        try {
            body = webClient.post()
                .uri(tokenUrl)
                .headers(headers -> headers.setBasicAuth(clientId, clientSecret))
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_FORM_URLENCODED_VALUE)
                .body(BodyInserters.fromFormData("grant_type", "client_credentials"))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block();
        } catch (RuntimeException e) {
            throw CatalogErrorTranslator.translate(e, "token");
        }
        if (body == null || !body.hasNonNull("access_token")) {
            throw CatalogApiException.permanent("Token endpoint returned no access_token");
        }
        accessToken = body.get("access_token").asText();
        expiresAt = clock.instant().plusSeconds(body.path("expires_in").asLong(3600));
        log.info("Obtained catalog API access token valid until {}", expiresAt);
        return accessToken;
    }

    public synchronized void invalidate() {
        accessToken = null;
        expiresAt = Instant.EPOCH;
    }
}
