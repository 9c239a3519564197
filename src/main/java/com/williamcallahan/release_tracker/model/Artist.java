package com.williamcallahan.release_tracker.model;

/**
 * A tracked artist as handed to the discovery engine.
 * Identity is the catalog-assigned {@code id}; {@code name} is informational only.
 *
 * @param id catalog artist identifier
 * @param name display name, may be {@code null}
 */
public record Artist(String id, String name) {
}
