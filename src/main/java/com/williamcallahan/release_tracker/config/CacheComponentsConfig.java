/**
 * Configuration class for cache-related components
 * - Process-local near cache in front of the persistent ISRC store
 * - Release TTL policy built from app.cache.ttl.*
 *
 * @author William Callahan
 */
package com.williamcallahan.release_tracker.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.release_tracker.model.IsrcEntry;
import com.williamcallahan.release_tracker.service.cache.ReleaseTtlPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CacheComponentsConfig {

    /**
     * ISRC entries never expire, so the near cache is only bounded by size.
     */
    @Bean
    public Cache<String, IsrcEntry> isrcNearCache() {
        return Caffeine.newBuilder()
                .maximumSize(50_000)
                .recordStats()
                .build();
    }

    @Bean
    public ReleaseTtlPolicy releaseTtlPolicy(AppConfigurationProperties properties) {
        AppConfigurationProperties.Cache.Ttl ttl = properties.getCache().getTtl();
        return ReleaseTtlPolicy.fromConfig(ttl.getTiers(), ttl.getDefault());
    }
}
