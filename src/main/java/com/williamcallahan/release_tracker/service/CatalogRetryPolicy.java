/**
 * Executes upstream catalog calls under the shared rate limit and retry rules
 *
 * @author William Callahan
 *
 * Features:
 * - Takes a rate limiter permit before every attempt
 * - Counts every attempt per operation in the {@link ApiRequestMonitor}
 * - Retries rate-limited and transient failures, raises permanent ones at once
 * - Converts unexpected exceptions into permanent catalog failures
 */
package com.williamcallahan.release_tracker.service;

import com.williamcallahan.release_tracker.exception.CatalogApiException;
import com.williamcallahan.release_tracker.monitoring.MetricsService;
import com.williamcallahan.release_tracker.util.ExternalApiLogger;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.RetryContext;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

@Service
@Slf4j
public class CatalogRetryPolicy {

    private static final String API_NAME = "Catalog";

    private final RetryTemplate retryTemplate;
    private final RateLimiter rateLimiter;
    private final ApiRequestMonitor apiRequestMonitor;
    private final MetricsService metricsService;

    public CatalogRetryPolicy(@Qualifier("catalogRetryTemplate") RetryTemplate retryTemplate,
                              @Qualifier("catalogApiRateLimiter") RateLimiter rateLimiter,
                              ApiRequestMonitor apiRequestMonitor,
                              MetricsService metricsService) {
        this.retryTemplate = retryTemplate;
        this.rateLimiter = rateLimiter;
        this.apiRequestMonitor = apiRequestMonitor;
        this.metricsService = metricsService;
    }

    /**
     * Runs one logical upstream call, retrying according to the failure kind.
     *
     * @param operation operation name used for call counting and logs
     * @param call the upstream call
     * @return the call's result
     * @throws CatalogApiException once the call cannot or may no longer be retried
     */
    public <T> T execute(String operation, Supplier<T> call) {
        try {
            return retryTemplate.execute((RetryContext context) -> attempt(operation, call, context.getRetryCount() + 1));
        } catch (CatalogApiException e) {
            if (e.getKind() == CatalogApiException.Kind.RATE_LIMITED) {
                // attempts are uncapped for rate limits, so escaping here means the deadline would be crossed
                ExternalApiLogger.logApiCallFailure(log, API_NAME, operation, "rate-limit deadline exceeded");
                throw CatalogApiException.transientFailure(
                    "rate-limit deadline exceeded for " + operation + ": " + e.getMessage(), e);
            }
            ExternalApiLogger.logApiCallFailure(log, API_NAME, operation, e.getKind() + " " + e.getMessage());
            throw e;
        }
    }

    private <T> T attempt(String operation, Supplier<T> call, int attemptNumber) {
        if (!rateLimiter.acquirePermission()) {
            throw CatalogApiException.transientFailure("Timed out waiting for a rate limiter permit for " + operation, null);
        }
        ExternalApiLogger.logApiCallAttempt(log, API_NAME, operation, attemptNumber);
        Timer.Sample sample = metricsService.startApiTimer();
        try {
            T result = call.get();
            apiRequestMonitor.recordSuccessfulRequest(operation);
            ExternalApiLogger.logApiCallSuccess(log, API_NAME, operation, attemptNumber);
            return result;
        } catch (CatalogApiException e) {
            apiRequestMonitor.recordFailedRequest(operation, e.getMessage());
            if (e.getKind() == CatalogApiException.Kind.RATE_LIMITED) {
                metricsService.incrementApiRateLimit();
            }
            throw e;
        } catch (RuntimeException e) {
            apiRequestMonitor.recordFailedRequest(operation, e.toString());
            throw new CatalogApiException(CatalogApiException.Kind.PERMANENT,
                "Unexpected failure in " + operation + ": " + e, e);
        } finally {
            metricsService.stopApiTimer(sample);
        }
    }
}
