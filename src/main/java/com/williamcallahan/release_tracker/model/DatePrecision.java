package com.williamcallahan.release_tracker.model;

/**
 * How much of a catalog release date the upstream actually supplied.
 */
public enum DatePrecision {
    YEAR,
    MONTH,
    DAY
}
