/**
 * Main application configuration properties
 * Centralizes all app.* configuration properties for type safety and IDE support
 *
 * @author William Callahan
 */

package com.williamcallahan.release_tracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "app")
public class AppConfigurationProperties {

    @NestedConfigurationProperty
    private Discovery discovery = new Discovery();

    @NestedConfigurationProperty
    private Cache cache = new Cache();

    @NestedConfigurationProperty
    private Retry retry = new Retry();

    @NestedConfigurationProperty
    private RateLimit rateLimit = new RateLimit();

    // Getters and setters
    public Discovery getDiscovery() { return discovery; }
    public void setDiscovery(Discovery discovery) { this.discovery = discovery; }

    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }

    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }

    public RateLimit getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimit rateLimit) { this.rateLimit = rateLimit; }

    // Nested configuration classes
    public static class Discovery {
        private int lookbackDays = 90;
        private int workerThreads = 8;
        private List<String> albumTypes = new ArrayList<>(List.of("album", "single", "compilation"));
        private List<String> noiseKeywords = new ArrayList<>(
            List.of("live", "remaster", "demo", "commentary", "instrumental", "karaoke"));
        private int pageSize = 50;

        public int getLookbackDays() { return lookbackDays; }
        public void setLookbackDays(int lookbackDays) { this.lookbackDays = lookbackDays; }

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }

        public List<String> getAlbumTypes() { return albumTypes; }
        public void setAlbumTypes(List<String> albumTypes) { this.albumTypes = albumTypes; }

        public List<String> getNoiseKeywords() { return noiseKeywords; }
        public void setNoiseKeywords(List<String> noiseKeywords) { this.noiseKeywords = noiseKeywords; }

        public int getPageSize() { return pageSize; }
        public void setPageSize(int pageSize) { this.pageSize = pageSize; }
    }

    public static class Cache {
        @NestedConfigurationProperty
        private Ttl ttl = new Ttl();

        @NestedConfigurationProperty
        private Maintenance maintenance = new Maintenance();

        public Ttl getTtl() { return ttl; }
        public void setTtl(Ttl ttl) { this.ttl = ttl; }

        public Maintenance getMaintenance() { return maintenance; }
        public void setMaintenance(Maintenance maintenance) { this.maintenance = maintenance; }

        /**
         * Release-age tiers written as {@code <maxAge>:<ttl>}, e.g. {@code 30d:6h}.
         * Releases older than every tier use {@link #defaultTtl}.
         */
        public static class Ttl {
            private List<String> tiers = new ArrayList<>(List.of("30d:6h", "180d:24h"));
            private Duration defaultTtl = Duration.ofHours(168);

            public List<String> getTiers() { return tiers; }
            public void setTiers(List<String> tiers) { this.tiers = tiers; }

            public Duration getDefault() { return defaultTtl; }
            public void setDefault(Duration defaultTtl) { this.defaultTtl = defaultTtl; }
        }

        public static class Maintenance {
            private boolean enabled = false;
            private String cron = "0 30 4 * * ?";
            private Duration maxAge = Duration.ofDays(30);

            public boolean isEnabled() { return enabled; }
            public void setEnabled(boolean enabled) { this.enabled = enabled; }

            public String getCron() { return cron; }
            public void setCron(String cron) { this.cron = cron; }

            public Duration getMaxAge() { return maxAge; }
            public void setMaxAge(Duration maxAge) { this.maxAge = maxAge; }
        }
    }

    public static class Retry {
        @NestedConfigurationProperty
        private CatalogApi catalogApi = new CatalogApi();

        public CatalogApi getCatalogApi() { return catalogApi; }
        public void setCatalogApi(CatalogApi catalogApi) { this.catalogApi = catalogApi; }

        public static class CatalogApi {
            private int maxAttempts = 3;
            private long initialBackoffMs = 2000;
            private double backoffMultiplier = 2.0;
            private double jitterFactor = 0.2;
            private Duration callDeadline = Duration.ofSeconds(120);

            public int getMaxAttempts() { return maxAttempts; }
            public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

            public long getInitialBackoffMs() { return initialBackoffMs; }
            public void setInitialBackoffMs(long initialBackoffMs) { this.initialBackoffMs = initialBackoffMs; }

            public double getBackoffMultiplier() { return backoffMultiplier; }
            public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }

            public double getJitterFactor() { return jitterFactor; }
            public void setJitterFactor(double jitterFactor) { this.jitterFactor = jitterFactor; }

            public Duration getCallDeadline() { return callDeadline; }
            public void setCallDeadline(Duration callDeadline) { this.callDeadline = callDeadline; }
        }
    }

    public static class RateLimit {
        @NestedConfigurationProperty
        private CatalogApi catalogApi = new CatalogApi();

        public CatalogApi getCatalogApi() { return catalogApi; }
        public void setCatalogApi(CatalogApi catalogApi) { this.catalogApi = catalogApi; }

        public static class CatalogApi {
            private int limitForPeriod = 10;
            private Duration refreshPeriod = Duration.ofSeconds(1);
            private Duration timeout = Duration.ofSeconds(30);

            public int getLimitForPeriod() { return limitForPeriod; }
            public void setLimitForPeriod(int limitForPeriod) { this.limitForPeriod = limitForPeriod; }

            public Duration getRefreshPeriod() { return refreshPeriod; }
            public void setRefreshPeriod(Duration refreshPeriod) { this.refreshPeriod = refreshPeriod; }

            public Duration getTimeout() { return timeout; }
            public void setTimeout(Duration timeout) { this.timeout = timeout; }
        }
    }
}
