package com.williamcallahan.release_tracker.model;

/**
 * An artist whose releases could not be determined in a discovery run.
 */
public record MissingArtist(String artistId, Reason reason, String message) {

    public enum Reason {
        PERMANENT_ERROR,
        TRANSIENT_ERROR,
        STORE_ERROR,
        DEADLINE_EXCEEDED,
        UNEXPECTED_ERROR
    }
}
