package com.williamcallahan.release_tracker.model;

import java.util.List;

/**
 * A single page of catalog entries for one artist and one album type.
 *
 * @param entries entries on this page, newest first within the type
 * @param nextOffset offset of the following page, {@code null} when this is the last page
 */
public record CatalogPage(List<CatalogEntry> entries, Integer nextOffset) {

    public CatalogPage {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public boolean hasNext() {
        return nextOffset != null;
    }

    public static CatalogPage last(List<CatalogEntry> entries) {
        return new CatalogPage(entries, null);
    }
}
