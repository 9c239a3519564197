/**
 * Tracks upstream catalog request volume per operation
 *
 * @author William Callahan
 *
 * Features:
 * - Hourly, daily and lifetime request counters split by success and failure
 * - Per-endpoint lifetime counts, used to report calls made by a discovery run
 * - Scheduled resets of the hourly and daily windows
 * - Thread-safe; workers record concurrently
 */
package com.williamcallahan.release_tracker.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

@Service
@Slf4j
public class ApiRequestMonitor {

    private final AtomicInteger hourlyRequests = new AtomicInteger();
    private final AtomicInteger hourlySuccessful = new AtomicInteger();
    private final AtomicInteger hourlyFailed = new AtomicInteger();

    private final AtomicInteger dailyRequests = new AtomicInteger();
    private final AtomicInteger dailySuccessful = new AtomicInteger();
    private final AtomicInteger dailyFailed = new AtomicInteger();

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong totalSuccessful = new AtomicLong();
    private final AtomicLong totalFailed = new AtomicLong();

    private final Map<String, LongAdder> endpointCounts = new ConcurrentHashMap<>();

    private volatile String lastError;

    public void recordSuccessfulRequest(String endpoint) {
        countRequest(endpoint);
        hourlySuccessful.incrementAndGet();
        dailySuccessful.incrementAndGet();
        totalSuccessful.incrementAndGet();
    }

    public void recordFailedRequest(String endpoint, String errorMessage) {
        countRequest(endpoint);
        hourlyFailed.incrementAndGet();
        dailyFailed.incrementAndGet();
        totalFailed.incrementAndGet();
        lastError = endpoint + ": " + errorMessage;
    }

    private void countRequest(String endpoint) {
        hourlyRequests.incrementAndGet();
        dailyRequests.incrementAndGet();
        totalRequests.incrementAndGet();
        endpointCounts.computeIfAbsent(endpoint, key -> new LongAdder()).increment();
    }

    public long getTotalRequests() {
        return totalRequests.get();
    }

    /**
     * Lifetime request count per endpoint at this instant. Callers diff two snapshots
     * to obtain the calls made in between.
     */
    public Map<String, Long> snapshotEndpointCounts() {
        Map<String, Long> snapshot = new TreeMap<>();
        endpointCounts.forEach((endpoint, count) -> snapshot.put(endpoint, count.sum()));
        return snapshot;
    }

    /**
     * Per-endpoint difference between two snapshots; endpoints with no calls in between are omitted.
     */
    public static Map<String, Long> delta(Map<String, Long> before, Map<String, Long> after) {
        Map<String, Long> delta = new TreeMap<>();
        after.forEach((endpoint, count) -> {
            long diff = count - before.getOrDefault(endpoint, 0L);
            if (diff > 0) {
                delta.put(endpoint, diff);
            }
        });
        return delta;
    }

    public Map<String, Object> getMetricsMap() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("hourly_requests", hourlyRequests.get());
        metrics.put("hourly_successful", hourlySuccessful.get());
        metrics.put("hourly_failed", hourlyFailed.get());
        metrics.put("daily_requests", dailyRequests.get());
        metrics.put("daily_successful", dailySuccessful.get());
        metrics.put("daily_failed", dailyFailed.get());
        metrics.put("total_requests", totalRequests.get());
        metrics.put("total_successful", totalSuccessful.get());
        metrics.put("total_failed", totalFailed.get());
        metrics.put("endpoints", snapshotEndpointCounts());
        metrics.put("last_error", lastError);
        return metrics;
    }

    public String generateReport() {
        StringBuilder report = new StringBuilder("Catalog API Request Monitor Report\n");
        report.append(String.format("Hourly: %d requests (%d successful, %d failed)%n",
            hourlyRequests.get(), hourlySuccessful.get(), hourlyFailed.get()));
        report.append(String.format("Daily: %d requests (%d successful, %d failed)%n",
            dailyRequests.get(), dailySuccessful.get(), dailyFailed.get()));
        report.append(String.format("Total: %d requests (%d successful, %d failed)%n",
            totalRequests.get(), totalSuccessful.get(), totalFailed.get()));
        report.append("Endpoint Counts:\n");
        snapshotEndpointCounts().forEach((endpoint, count) ->
            report.append(String.format("  %s: %d requests%n", endpoint, count)));
        return report.toString();
    }

    @Scheduled(cron = "0 0 * * * *")
    public void resetHourlyCounters() {
        log.debug("Resetting hourly catalog API counters ({} requests this hour)", hourlyRequests.get());
        hourlyRequests.set(0);
        hourlySuccessful.set(0);
        hourlyFailed.set(0);
    }

    @Scheduled(cron = "0 0 0 * * *")
    public void resetDailyCounters() {
        log.info("Resetting daily catalog API counters ({} requests today)", dailyRequests.get());
        dailyRequests.set(0);
        dailySuccessful.set(0);
        dailyFailed.set(0);
    }
}
