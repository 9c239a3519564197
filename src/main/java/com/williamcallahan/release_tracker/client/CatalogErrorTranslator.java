package com.williamcallahan.release_tracker.client;

import com.williamcallahan.release_tracker.exception.CatalogApiException;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Maps WebClient failures onto {@link CatalogApiException} kinds.
 */
final class CatalogErrorTranslator {

    private CatalogErrorTranslator() {
    }

    static CatalogApiException translate(Throwable error, String endpoint) {
        Throwable cause = Exceptions.unwrap(error);
        if (cause instanceof CatalogApiException cae) {
            return cae;
        }
        if (cause instanceof WebClientResponseException wcre) {
            int status = wcre.getStatusCode().value();
            String message = endpoint + " returned HTTP " + status;
            if (status == 429) {
                return CatalogApiException.rateLimited(message, parseRetryAfter(wcre.getHeaders()));
            }
            if (wcre.getStatusCode().is5xxServerError()) {
                return new CatalogApiException(CatalogApiException.Kind.TRANSIENT, message, status, null, wcre);
            }
            return new CatalogApiException(CatalogApiException.Kind.PERMANENT, message, status, null, wcre);
        }
        if (cause instanceof WebClientRequestException || cause instanceof IOException
            || cause instanceof TimeoutException) {
            return CatalogApiException.transientFailure(endpoint + " failed: " + cause, cause);
        }
        return new CatalogApiException(CatalogApiException.Kind.PERMANENT, endpoint + " failed: " + cause, cause);
    }

    /**
     * Reads a delta-seconds {@code Retry-After} header. HTTP-date values are not used by the catalog.
     */
    static Duration parseRetryAfter(HttpHeaders headers) {
        String value = headers == null ? null : headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(value.trim());
            return seconds < 0 ? null : Duration.ofSeconds(seconds);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
