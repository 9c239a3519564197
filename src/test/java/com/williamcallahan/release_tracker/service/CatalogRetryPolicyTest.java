package com.williamcallahan.release_tracker.service;

import com.williamcallahan.release_tracker.config.AppConfigurationProperties;
import com.williamcallahan.release_tracker.config.RetryConfig;
import com.williamcallahan.release_tracker.exception.CatalogApiException;
import com.williamcallahan.release_tracker.monitoring.MetricsService;
import com.williamcallahan.release_tracker.testutil.MutableClock;
import com.williamcallahan.release_tracker.testutil.RecordingSleeper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CatalogRetryPolicyTest {

    private static final String OPERATION = "getTrackDetail";

    private MutableClock clock;
    private RecordingSleeper sleeper;
    private SimpleMeterRegistry meterRegistry;
    private MetricsService metricsService;
    private ApiRequestMonitor apiRequestMonitor;
    private AppConfigurationProperties.Retry.CatalogApi settings;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-06-15T12:00:00Z"));
        sleeper = new RecordingSleeper(clock);
        meterRegistry = new SimpleMeterRegistry();
        metricsService = new MetricsService(meterRegistry);
        apiRequestMonitor = new ApiRequestMonitor();
        settings = new AppConfigurationProperties.Retry.CatalogApi();
    }

    private CatalogRetryPolicy policy(DoubleSupplier jitter) {
        return new CatalogRetryPolicy(
            RetryConfig.buildCatalogRetryTemplate(settings, clock, sleeper, jitter, metricsService),
            RateLimiter.ofDefaults("catalog-test"),
            apiRequestMonitor,
            metricsService);
    }

    @Test
    void rateLimited_sleepsExactlyRetryAfterThenSucceeds() {
        ScriptedCall call = new ScriptedCall(
            CatalogApiException.rateLimited("slow down", Duration.ofSeconds(3)),
            CatalogApiException.rateLimited("slow down", Duration.ofSeconds(5)));

        String result = policy(() -> 0.7).execute(OPERATION, call);

        assertThat(result).isEqualTo("ok");
        assertThat(sleeper.getSleeps()).containsExactly(3000L, 5000L);
        assertThat(call.attempts).isEqualTo(3);
        assertThat(apiRequestMonitor.snapshotEndpointCounts()).containsEntry(OPERATION, 3L);
        assertThat(meterRegistry.get("catalog.api.rate_limits").counter().count()).isEqualTo(2.0);
    }

    @Test
    void rateLimited_attemptsAreNotCappedByMaxAttempts() {
        List<CatalogApiException> failures = List.of(
            CatalogApiException.rateLimited("429", Duration.ofSeconds(1)),
            CatalogApiException.rateLimited("429", Duration.ofSeconds(1)),
            CatalogApiException.rateLimited("429", Duration.ofSeconds(1)),
            CatalogApiException.rateLimited("429", Duration.ofSeconds(1)),
            CatalogApiException.rateLimited("429", Duration.ofSeconds(1)));
        ScriptedCall call = new ScriptedCall(failures.toArray(new CatalogApiException[0]));

        assertThat(policy(() -> 0.0).execute(OPERATION, call)).isEqualTo("ok");
        assertThat(call.attempts).isEqualTo(6);
    }

    @Test
    void rateLimited_withoutRetryAfterUsesBaseDelay() {
        ScriptedCall call = new ScriptedCall(CatalogApiException.rateLimited("429", null));

        policy(() -> 0.0).execute(OPERATION, call);

        assertThat(sleeper.getSleeps()).containsExactly(2000L);
    }

    @Test
    void rateLimited_waitPastDeadlineFailsAsTransient() {
        settings.setCallDeadline(Duration.ofSeconds(120));
        ScriptedCall call = new ScriptedCall(CatalogApiException.rateLimited("429", Duration.ofSeconds(300)));

        assertThatThrownBy(() -> policy(() -> 0.0).execute(OPERATION, call))
            .isInstanceOfSatisfying(CatalogApiException.class, e -> {
                assertThat(e.getKind()).isEqualTo(CatalogApiException.Kind.TRANSIENT);
                assertThat(e.getMessage()).contains("rate-limit deadline exceeded");
            });
        assertThat(sleeper.getSleeps()).isEmpty();
        assertThat(call.attempts).isEqualTo(1);
    }

    @Test
    void transient_backsOffExponentiallyAndRaisesLastErrorAfterMaxAttempts() {
        CatalogApiException last = CatalogApiException.transientFailure("503 #3", null);
        ScriptedCall call = new ScriptedCall(
            CatalogApiException.transientFailure("503 #1", null),
            CatalogApiException.transientFailure("503 #2", null),
            last);

        assertThatThrownBy(() -> policy(() -> 0.0).execute(OPERATION, call)).isSameAs(last);
        assertThat(call.attempts).isEqualTo(3);
        assertThat(sleeper.getSleeps()).containsExactly(2000L, 4000L);
        assertThat(meterRegistry.get("catalog.api.retries").counter().count()).isEqualTo(2.0);
    }

    @Test
    void transient_jitterAddsAtMostTwentyPercent() {
        ScriptedCall call = new ScriptedCall(
            CatalogApiException.transientFailure("timeout", null),
            CatalogApiException.transientFailure("timeout", null));

        policy(() -> 1.0).execute(OPERATION, call);

        assertThat(sleeper.getSleeps()).containsExactly(2400L, 4800L);
    }

    @Test
    void permanent_isRaisedWithoutRetry() {
        CatalogApiException notFound = new CatalogApiException(CatalogApiException.Kind.PERMANENT, "404", 404, null, null);
        ScriptedCall call = new ScriptedCall(notFound);

        assertThatThrownBy(() -> policy(() -> 0.0).execute(OPERATION, call)).isSameAs(notFound);
        assertThat(call.attempts).isEqualTo(1);
        assertThat(sleeper.getSleeps()).isEmpty();
    }

    @Test
    void unexpectedException_isWrappedAsPermanentAndNotRetried() {
        IllegalStateException boom = new IllegalStateException("bad payload");
        int[] attempts = {0};

        assertThatThrownBy(() -> policy(() -> 0.0).execute(OPERATION, () -> {
            attempts[0]++;
            throw boom;
        }))
            .isInstanceOfSatisfying(CatalogApiException.class, e -> {
                assertThat(e.getKind()).isEqualTo(CatalogApiException.Kind.PERMANENT);
                assertThat(e.getCause()).isSameAs(boom);
            });
        assertThat(attempts[0]).isEqualTo(1);
        assertThat(apiRequestMonitor.getMetricsMap().get("total_failed")).isEqualTo(1L);
    }

    /**
     * Throws the scripted failures in order, then returns "ok".
     */
    private static final class ScriptedCall implements Supplier<String> {
        private final Deque<CatalogApiException> failures;
        private int attempts;

        ScriptedCall(CatalogApiException... failures) {
            this.failures = new ArrayDeque<>(List.of(failures));
        }

        @Override
        public String get() {
            attempts++;
            CatalogApiException next = failures.poll();
            if (next != null) {
                throw next;
            }
            return "ok";
        }
    }
}
