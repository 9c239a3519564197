package com.williamcallahan.release_tracker.model;

/**
 * Pagination state for one album type of one artist during a single fetch.
 * Each type owns its cursor so stopping one group never affects another.
 */
public final class FetchCursor {

    /**
     * Per-type scan state machine: {@code SCANNING -> EARLY_STOPPED | EXHAUSTED}.
     */
    public enum TypeScanState {
        SCANNING,
        EARLY_STOPPED,
        EXHAUSTED
    }

    private final AlbumType type;
    private int nextOffset;
    private TypeScanState state = TypeScanState.SCANNING;
    private int pagesVisited;

    public FetchCursor(AlbumType type) {
        this.type = type;
    }

    public AlbumType getType() {
        return type;
    }

    public int getNextOffset() {
        return nextOffset;
    }

    public TypeScanState getState() {
        return state;
    }

    public int getPagesVisited() {
        return pagesVisited;
    }

    public boolean isScanning() {
        return state == TypeScanState.SCANNING;
    }

    /**
     * Records a scanned page and moves the cursor.
     *
     * @param page the page just scanned
     * @param anyEntryInWindow whether at least one entry on the page is on or after the cutoff
     */
    public void advance(CatalogPage page, boolean anyEntryInWindow) {
        if (!isScanning()) {
            throw new IllegalStateException("Cursor for " + type + " is already " + state);
        }
        pagesVisited++;
        if (!anyEntryInWindow) {
            state = TypeScanState.EARLY_STOPPED;
        } else if (!page.hasNext()) {
            state = TypeScanState.EXHAUSTED;
        } else {
            nextOffset = page.nextOffset();
        }
    }

    @Override
    public String toString() {
        return "FetchCursor{" + type + ", offset=" + nextOffset + ", state=" + state + ", pages=" + pagesVisited + "}";
    }
}
