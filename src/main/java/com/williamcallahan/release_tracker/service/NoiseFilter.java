package com.williamcallahan.release_tracker.service;

import com.williamcallahan.release_tracker.config.AppConfigurationProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Flags track names that denote alternate versions (live takes, remasters, demos and the like).
 * Matching is a case-insensitive substring test against a keyword vocabulary.
 */
@Component
public class NoiseFilter {

    public static final List<String> DEFAULT_KEYWORDS =
        List.of("live", "remaster", "demo", "commentary", "instrumental", "karaoke");

    private final List<String> keywords;

    @Autowired
    public NoiseFilter(AppConfigurationProperties properties) {
        this(properties.getDiscovery().getNoiseKeywords());
    }

    public NoiseFilter(List<String> keywords) {
        this.keywords = keywords.stream()
            .filter(keyword -> keyword != null && !keyword.isBlank())
            .map(keyword -> keyword.trim().toLowerCase(Locale.ROOT))
            .toList();
    }

    public boolean isNoise(String trackName) {
        if (trackName == null) {
            return false;
        }
        String normalized = trackName.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (normalized.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
