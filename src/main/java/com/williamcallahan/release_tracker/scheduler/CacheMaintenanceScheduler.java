/**
 * Scheduled purge of long-unconfirmed cached releases
 *
 * @author William Callahan
 *
 * Features:
 * - Disabled unless app.cache.maintenance.enabled is true
 * - Runs on app.cache.maintenance.cron, nightly by default
 * - Failures are logged and retried on the next schedule
 */
package com.williamcallahan.release_tracker.scheduler;

import com.williamcallahan.release_tracker.config.AppConfigurationProperties;
import com.williamcallahan.release_tracker.service.CacheMaintenanceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class CacheMaintenanceScheduler {

    private final CacheMaintenanceService cacheMaintenanceService;
    private final AppConfigurationProperties properties;

    public CacheMaintenanceScheduler(CacheMaintenanceService cacheMaintenanceService,
                                     AppConfigurationProperties properties) {
        this.cacheMaintenanceService = cacheMaintenanceService;
        this.properties = properties;
    }

    @Scheduled(cron = "${app.cache.maintenance.cron:0 30 4 * * ?}")
    public void purgeExpiredReleases() {
        AppConfigurationProperties.Cache.Maintenance maintenance = properties.getCache().getMaintenance();
        if (!maintenance.isEnabled()) {
            log.debug("Cache maintenance is disabled. Skipping purge.");
            return;
        }
        try {
            int deleted = cacheMaintenanceService.purgeReleasesFetchedBefore(maintenance.getMaxAge());
            log.info("Scheduled cache maintenance removed {} release(s)", deleted);
        } catch (RuntimeException e) {
            log.error("Scheduled cache maintenance failed: {}", e.getMessage(), e);
        }
    }
}
