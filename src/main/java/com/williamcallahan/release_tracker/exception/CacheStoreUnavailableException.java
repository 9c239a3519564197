package com.williamcallahan.release_tracker.exception;

/**
 * Raised when the persistent store is unreachable at the start of a discovery run.
 * This is the only condition that aborts a whole run.
 */
public class CacheStoreUnavailableException extends RuntimeException {

    public CacheStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
