package com.williamcallahan.release_tracker.util;

import com.williamcallahan.release_tracker.model.DatePrecision;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses catalog release dates, which may be given at year, month or day precision.
 * Missing components default to the first of the period.
 */
public final class ReleaseDates {

    private ReleaseDates() {
    }

    /**
     * Parses a release date string.
     *
     * @param raw date as {@code yyyy}, {@code yyyy-MM} or {@code yyyy-MM-dd}
     * @return the parsed date, or empty when the value is blank or malformed
     */
    public static Optional<LocalDate> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();
        try {
            return switch (value.length()) {
                case 4 -> Optional.of(LocalDate.of(Integer.parseInt(value), 1, 1));
                case 7 -> Optional.of(LocalDate.parse(value + "-01"));
                case 10 -> Optional.of(LocalDate.parse(value));
                default -> Optional.empty();
            };
        } catch (NumberFormatException | DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Uses the declared precision when recognised, else infers it from the shape of the raw value.
     */
    public static DatePrecision precisionOf(String raw, String declared) {
        if (declared != null) {
            switch (declared.toLowerCase(Locale.ROOT)) {
                case "year":
                    return DatePrecision.YEAR;
                case "month":
                    return DatePrecision.MONTH;
                case "day":
                    return DatePrecision.DAY;
                default:
                    break;
            }
        }
        if (raw == null) {
            return DatePrecision.DAY;
        }
        return switch (raw.trim().length()) {
            case 4 -> DatePrecision.YEAR;
            case 7 -> DatePrecision.MONTH;
            default -> DatePrecision.DAY;
        };
    }
}
