package com.williamcallahan.release_tracker.model;

/**
 * Track listing row of a catalog entry, before its detail lookup.
 */
public record CatalogTrack(String id, String name) {
}
