package com.williamcallahan.release_tracker.model;

import java.time.Instant;

/**
 * One row of discovery run history.
 */
public record RunRecord(
    Instant runTimestamp,
    int artistsTracked,
    int releasesFound,
    int lookbackDays,
    double durationSeconds,
    long apiCallsMade,
    String status
) {
}
