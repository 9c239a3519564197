/**
 * Utility class for standardized error handling across the discovery pipeline
 * Maps arbitrary failures onto the per-artist failure reasons reported to callers
 *
 * @author William Callahan
 */

package com.williamcallahan.release_tracker.util;

import com.williamcallahan.release_tracker.exception.CacheCorruptionException;
import com.williamcallahan.release_tracker.exception.CatalogApiException;
import com.williamcallahan.release_tracker.model.MissingArtist;
import org.springframework.dao.DataAccessException;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public final class ErrorHandlingUtils {

    private ErrorHandlingUtils() {
    }

    /**
     * Categorize an exception into a per-artist failure reason
     */
    public static MissingArtist.Reason categorize(Throwable throwable) {
        Throwable cause = unwrap(throwable);
        if (cause instanceof CatalogApiException cae) {
            return cae.getKind() == CatalogApiException.Kind.PERMANENT
                ? MissingArtist.Reason.PERMANENT_ERROR
                : MissingArtist.Reason.TRANSIENT_ERROR;
        }
        if (cause instanceof DataAccessException || cause instanceof CacheCorruptionException) {
            return MissingArtist.Reason.STORE_ERROR;
        }
        if (cause instanceof CancellationException || cause instanceof InterruptedException) {
            return MissingArtist.Reason.DEADLINE_EXCEEDED;
        }
        return MissingArtist.Reason.UNEXPECTED_ERROR;
    }

    /**
     * Strips the wrappers added by {@code CompletableFuture} and executor plumbing.
     */
    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Short human readable description, never {@code null}.
     */
    public static String describe(Throwable throwable) {
        Throwable cause = unwrap(throwable);
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
