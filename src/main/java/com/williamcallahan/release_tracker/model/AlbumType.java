package com.williamcallahan.release_tracker.model;

import java.util.Locale;

/**
 * Catalog entry groups as returned by the upstream catalog.
 * The upstream orders entries by date only inside one group.
 */
public enum AlbumType {
    ALBUM("album"),
    SINGLE("single"),
    COMPILATION("compilation"),
    APPEARS_ON("appears_on");

    private final String apiValue;

    AlbumType(String apiValue) {
        this.apiValue = apiValue;
    }

    public String apiValue() {
        return apiValue;
    }

    /**
     * Resolves an upstream or configuration value ("album", "Single", "appears_on") to its type.
     *
     * @throws IllegalArgumentException when the value names no known group
     */
    public static AlbumType fromApiValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Album type must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AlbumType type : values()) {
            if (type.apiValue.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown album type: " + value);
    }
}
