package com.williamcallahan.release_tracker.service;

import com.williamcallahan.release_tracker.model.Release;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Caps an artist's releases to the most popular ones.
 */
@Component
public class PopularityRanker {

    static final Comparator<Release> BY_POPULARITY = Comparator.comparingInt(Release::popularity).reversed()
        .thenComparing(Release::releaseDate, Comparator.reverseOrder())
        .thenComparing(Release::trackId);

    /**
     * @param maxPerArtist cap, or {@code null} to return the input unchanged
     * @return at most {@code maxPerArtist} releases, most popular first
     */
    public List<Release> cap(List<Release> releases, Integer maxPerArtist) {
        if (maxPerArtist == null) {
            return releases;
        }
        return releases.stream()
            .sorted(BY_POPULARITY)
            .limit(maxPerArtist)
            .toList();
    }
}
