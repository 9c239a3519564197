package com.williamcallahan.release_tracker.exception;

import java.time.Duration;
import java.util.Optional;

/**
 * Failure reported by the upstream catalog, classified by how the caller should react.
 *
 * @author William Callahan
 *
 * Features:
 * - {@link Kind#RATE_LIMITED} carries the server-provided retry-after when known
 * - {@link Kind#TRANSIENT} covers 5xx responses, I/O errors and timeouts
 * - {@link Kind#PERMANENT} covers validation, not-found and authorization failures
 */
public class CatalogApiException extends RuntimeException {

    public enum Kind {
        RATE_LIMITED,
        TRANSIENT,
        PERMANENT
    }

    private final Kind kind;
    private final Duration retryAfter;
    private final Integer statusCode;

    public CatalogApiException(Kind kind, String message) {
        this(kind, message, null, null, null);
    }

    public CatalogApiException(Kind kind, String message, Throwable cause) {
        this(kind, message, null, null, cause);
    }

    public CatalogApiException(Kind kind, String message, Integer statusCode, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
        this.retryAfter = retryAfter;
    }

    public static CatalogApiException rateLimited(String message, Duration retryAfter) {
        return new CatalogApiException(Kind.RATE_LIMITED, message, 429, retryAfter, null);
    }

    public static CatalogApiException transientFailure(String message, Throwable cause) {
        return new CatalogApiException(Kind.TRANSIENT, message, cause);
    }

    public static CatalogApiException permanent(String message) {
        return new CatalogApiException(Kind.PERMANENT, message);
    }

    public Kind getKind() {
        return kind;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    public Optional<Integer> getStatusCode() {
        return Optional.ofNullable(statusCode);
    }

    public boolean isRetryable() {
        return kind != Kind.PERMANENT;
    }
}
