package net.kairo.core.service;

import java.time.Duration;
import java.util.Objects;

public record SchedulerSettings(
        Duration tickInterval,
        Duration initialDelay,
        Duration executionTimeout,
        Duration gracePeriod,      // how long a tick waits for its own dispatches
        int maxConcurrentDispatches,
        boolean claimEnabled,
        String owner,              // lease owner token
        Duration shutdownTimeout
) {
    public SchedulerSettings {
        Objects.requireNonNull(tickInterval, "tickInterval");
        Objects.requireNonNull(initialDelay, "initialDelay");
        Objects.requireNonNull(executionTimeout, "executionTimeout");
        Objects.requireNonNull(gracePeriod, "gracePeriod");
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        if (tickInterval.isZero() || tickInterval.isNegative()) {
            throw new IllegalArgumentException("tickInterval must be positive: " + tickInterval);
        }
        if (executionTimeout.isZero() || executionTimeout.isNegative()) {
            throw new IllegalArgumentException("executionTimeout must be positive: " + executionTimeout);
        }
        if (maxConcurrentDispatches < 1) {
            throw new IllegalArgumentException("maxConcurrentDispatches must be >= 1: " + maxConcurrentDispatches);
        }
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(
                Duration.ofMinutes(1),
                Duration.ZERO,
                Duration.ofMinutes(5),
                Duration.ofSeconds(30),
                8,
                true,
                "kairo",
                Duration.ofSeconds(30));
    }

    public Duration leaseDuration() {
        return executionTimeout.plus(gracePeriod);
    }

    public SchedulerSettings withTickInterval(Duration d) {
        return new SchedulerSettings(d, initialDelay, executionTimeout, gracePeriod, maxConcurrentDispatches, claimEnabled, owner, shutdownTimeout);
    }

    public SchedulerSettings withExecutionTimeout(Duration d) {
        return new SchedulerSettings(tickInterval, initialDelay, d, gracePeriod, maxConcurrentDispatches, claimEnabled, owner, shutdownTimeout);
    }

    public SchedulerSettings withGracePeriod(Duration d) {
        return new SchedulerSettings(tickInterval, initialDelay, executionTimeout, d, maxConcurrentDispatches, claimEnabled, owner, shutdownTimeout);
    }

    public SchedulerSettings withMaxConcurrentDispatches(int n) {
        return new SchedulerSettings(tickInterval, initialDelay, executionTimeout, gracePeriod, n, claimEnabled, owner, shutdownTimeout);
    }

    public SchedulerSettings withOwner(String o) {
        return new SchedulerSettings(tickInterval, initialDelay, executionTimeout, gracePeriod, maxConcurrentDispatches, claimEnabled, o, shutdownTimeout);
    }
}
