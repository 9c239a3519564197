package com.williamcallahan.release_tracker.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation shared by every worker of one discovery run.
 * A run is cancelled either explicitly or once its deadline has passed.
 */
public final class RunControl {

    private final Clock clock;
    private final Instant deadline;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private RunControl(Clock clock, Instant deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    public static RunControl unbounded(Clock clock) {
        return new RunControl(clock, null);
    }

    public static RunControl withTimeout(Clock clock, Duration timeout) {
        if (timeout == null) {
            return unbounded(clock);
        }
        return new RunControl(clock, clock.instant().plus(timeout));
    }

    public Optional<Instant> getDeadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * Time left before the deadline, never negative. Empty when the run has no deadline.
     */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    public boolean isDeadlinePassed() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || isDeadlinePassed();
    }
}
