package com.williamcallahan.release_tracker.exception;

/**
 * Raised when a stored cache row cannot be mapped back to a domain object.
 * Callers treat the affected lookup as a cache miss.
 */
public class CacheCorruptionException extends RuntimeException {

    public CacheCorruptionException(String message) {
        super(message);
    }

    public CacheCorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
