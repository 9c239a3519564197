/**
 * Configuration for retrying and throttling upstream catalog calls
 *
 * @author William Callahan
 *
 * Features:
 * - Retry policy aware of the catalog failure kinds (rate limited, transient, permanent)
 * - Honors server-provided retry-after waits exactly, bounded by a per-call deadline
 * - Exponential backoff with jitter for transient failures
 * - Shared rate limiter so all workers together stay under the upstream call rate
 */

package com.williamcallahan.release_tracker.config;

import com.williamcallahan.release_tracker.exception.CatalogApiException;
import com.williamcallahan.release_tracker.monitoring.MetricsService;
import com.williamcallahan.release_tracker.util.ExternalApiLogger;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryPolicy;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.context.RetryContextSupport;
import org.springframework.retry.support.RetryTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

@Configuration
@EnableRetry
public class RetryConfig {

    private static final String API_NAME = "Catalog";

    @Bean
    public Sleeper retrySleeper() {
        return new ThreadWaitSleeper();
    }

    /**
     * Creates the retry template used for every upstream catalog call
     *
     * @return RetryTemplate configured from {@code app.retry.catalog-api.*}
     */
    @Bean("catalogRetryTemplate")
    public RetryTemplate catalogRetryTemplate(AppConfigurationProperties properties,
                                              Clock clock,
                                              Sleeper retrySleeper,
                                              MetricsService metricsService) {
        return buildCatalogRetryTemplate(properties.getRetry().getCatalogApi(), clock, retrySleeper,
            () -> ThreadLocalRandom.current().nextDouble(), metricsService);
    }

    /**
     * Creates the limiter shared by all discovery workers
     *
     * @return RateLimiter configured from {@code app.rate-limit.catalog-api.*}
     */
    @Bean("catalogApiRateLimiter")
    public RateLimiter catalogApiRateLimiter(AppConfigurationProperties properties) {
        AppConfigurationProperties.RateLimit.CatalogApi limits = properties.getRateLimit().getCatalogApi();
        RateLimiterConfig config = RateLimiterConfig.custom()
            .limitForPeriod(limits.getLimitForPeriod())
            .limitRefreshPeriod(limits.getRefreshPeriod())
            .timeoutDuration(limits.getTimeout())
            .build();
        return RateLimiter.of("catalogApi", config);
    }

    public static RetryTemplate buildCatalogRetryTemplate(AppConfigurationProperties.Retry.CatalogApi settings,
                                                          Clock clock,
                                                          Sleeper sleeper,
                                                          DoubleSupplier jitterSource,
                                                          MetricsService metricsService) {
        RetryTemplate retryTemplate = new RetryTemplate();
        retryTemplate.setRetryPolicy(new CatalogApiRetryPolicy(settings, clock));
        retryTemplate.setBackOffPolicy(new CatalogApiBackOffPolicy(settings, sleeper, jitterSource, metricsService));
        return retryTemplate;
    }

    /**
     * Retry context carrying the call deadline and the number of transient failures.
     * Rate-limited attempts do not count toward the attempt cap.
     */
    static class CatalogRetryContext extends RetryContextSupport {
        private final Instant deadline;
        private int transientFailures;
        private boolean retryAllowed = true;

        CatalogRetryContext(RetryContext parent, Instant deadline) {
            super(parent);
            this.deadline = deadline;
        }
    }

    /**
     * Decides whether a failed catalog call may be attempted again.
     * The decision is taken once per failure so time spent in the backoff
     * that follows cannot revoke it.
     */
    public static class CatalogApiRetryPolicy implements RetryPolicy {
        private final AppConfigurationProperties.Retry.CatalogApi settings;
        private final Clock clock;

        public CatalogApiRetryPolicy(AppConfigurationProperties.Retry.CatalogApi settings, Clock clock) {
            this.settings = settings;
            this.clock = clock;
        }

        @Override
        public boolean canRetry(RetryContext context) {
            return ((CatalogRetryContext) context).retryAllowed;
        }

        @Override
        public RetryContext open(RetryContext parent) {
            return new CatalogRetryContext(parent, clock.instant().plus(settings.getCallDeadline()));
        }

        @Override
        public void close(RetryContext context) {
            // nothing held per call
        }

        @Override
        public void registerThrowable(RetryContext context, Throwable throwable) {
            CatalogRetryContext ctx = (CatalogRetryContext) context;
            ctx.registerThrowable(throwable);
            if (!(throwable instanceof CatalogApiException cae)) {
                ctx.retryAllowed = false;
                return;
            }
            Instant now = clock.instant();
            switch (cae.getKind()) {
                case RATE_LIMITED -> ctx.retryAllowed =
                    !now.plus(rateLimitWait(cae, settings)).isAfter(ctx.deadline);
                case TRANSIENT -> {
                    ctx.transientFailures++;
                    ctx.retryAllowed = ctx.transientFailures < settings.getMaxAttempts() && now.isBefore(ctx.deadline);
                }
                default -> ctx.retryAllowed = false;
            }
        }

        @Override
        public int getMaxAttempts() {
            return settings.getMaxAttempts();
        }
    }

    /**
     * Sleeps between catalog attempts: the exact retry-after for rate limits,
     * {@code base * multiplier^(n-1)} plus up to {@code jitterFactor} for the n-th transient failure.
     */
    public static class CatalogApiBackOffPolicy implements BackOffPolicy {
        private static final Logger logger = LoggerFactory.getLogger(CatalogApiBackOffPolicy.class);

        private final AppConfigurationProperties.Retry.CatalogApi settings;
        private final Sleeper sleeper;
        private final DoubleSupplier jitterSource;
        private final MetricsService metricsService;

        public CatalogApiBackOffPolicy(AppConfigurationProperties.Retry.CatalogApi settings,
                                       Sleeper sleeper,
                                       DoubleSupplier jitterSource,
                                       MetricsService metricsService) {
            this.settings = settings;
            this.sleeper = sleeper;
            this.jitterSource = jitterSource;
            this.metricsService = metricsService;
        }

        private static class BackOffContextImpl implements BackOffContext {
            private final CatalogRetryContext retryContext;

            BackOffContextImpl(CatalogRetryContext retryContext) {
                this.retryContext = retryContext;
            }
        }

        @Override
        public BackOffContext start(RetryContext context) {
            return new BackOffContextImpl((CatalogRetryContext) context);
        }

        @Override
        public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
            CatalogRetryContext ctx = ((BackOffContextImpl) backOffContext).retryContext;
            long sleepTime;
            if (ctx.getLastThrowable() instanceof CatalogApiException cae
                && cae.getKind() == CatalogApiException.Kind.RATE_LIMITED) {
                Duration wait = rateLimitWait(cae, settings);
                ExternalApiLogger.logRateLimitWait(logger, API_NAME, cae.getMessage(), wait);
                sleepTime = wait.toMillis();
            } else {
                sleepTime = transientBackoffMillis(ctx.transientFailures);
                ExternalApiLogger.logRetryBackoff(logger, API_NAME, String.valueOf(ctx.getLastThrowable()),
                    ctx.getRetryCount(), sleepTime);
            }
            if (metricsService != null) {
                metricsService.incrementApiRetry();
            }
            try {
                sleeper.sleep(sleepTime);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BackOffInterruptedException("Thread interrupted while backing off", e);
            }
        }

        long transientBackoffMillis(int failureNumber) {
            double base = settings.getInitialBackoffMs() * Math.pow(settings.getBackoffMultiplier(), Math.max(0, failureNumber - 1));
            double jitter = base * settings.getJitterFactor() * jitterSource.getAsDouble();
            return Math.max(1, Math.round(base + jitter));
        }
    }

    static Duration rateLimitWait(CatalogApiException exception, AppConfigurationProperties.Retry.CatalogApi settings) {
        return exception.getRetryAfter().orElse(Duration.ofMillis(settings.getInitialBackoffMs()));
    }
}
