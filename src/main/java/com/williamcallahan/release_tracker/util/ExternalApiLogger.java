package com.williamcallahan.release_tracker.util;

import org.slf4j.Logger;

import java.time.Duration;

/**
 * Centralized logging for calls made to the upstream catalog.
 *
 * Every line carries the {@code [EXTERNAL-API]} prefix so a single grep shows the
 * full call trail of a discovery run:
 * - attempts and outcomes per operation
 * - retry backoffs and rate-limit waits
 * - raw HTTP request/response lines from the catalog client
 */
public final class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
    }

    /**
     * Log an upstream call attempt
     */
    public static void logApiCallAttempt(Logger log, String apiName, String operation, int attempt) {
        log.debug("{} [{}] ATTEMPT #{}: {}", PREFIX, apiName, attempt, operation);
    }

    /**
     * Log an upstream call success
     */
    public static void logApiCallSuccess(Logger log, String apiName, String operation, int attempt) {
        log.debug("{} [{}] SUCCESS: {} after {} attempt(s)", PREFIX, apiName, operation, attempt);
    }

    /**
     * Log an upstream call failure
     */
    public static void logApiCallFailure(Logger log, String apiName, String operation, String reason) {
        log.warn("{} [{}] FAILURE: {} - {}", PREFIX, apiName, operation, reason);
    }

    public static void logRetryBackoff(Logger log, String apiName, String operation, int attempt, long sleepMillis) {
        log.info("{} [{}] RETRY: {} attempt #{} failed, backing off {}ms", PREFIX, apiName, operation, attempt, sleepMillis);
    }

    public static void logRateLimitWait(Logger log, String apiName, String operation, Duration wait) {
        log.warn("{} [{}] RATE-LIMITED: {} waiting {}s as instructed by upstream", PREFIX, apiName, operation, wait.toSeconds());
    }

    /**
     * Log HTTP request details
     */
    public static void logHttpRequest(Logger log, String method, String url) {
        log.debug("{} [HTTP] {} request to: {}", PREFIX, method, url);
    }

    /**
     * Log HTTP response details
     */
    public static void logHttpResponse(Logger log, int statusCode, String url) {
        log.debug("{} [HTTP] Response: status={}, url={}", PREFIX, statusCode, url);
    }
}
