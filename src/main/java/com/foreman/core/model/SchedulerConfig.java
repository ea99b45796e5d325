package com.foreman.core.model;

import java.time.Duration;

/**
 * Limits applied by the scheduler loop for one run.
 *
 * @param perTaskTimeout     how long the scheduler waits for a single delegate call
 * @param maxRetries         retries allowed per task after its first failed attempt
 * @param maxTotalIterations hard ceiling on scheduling passes
 * @param maxParallel        delegate calls allowed in flight at once
 */
public record SchedulerConfig(
    Duration perTaskTimeout,
    int maxRetries,
    int maxTotalIterations,
    int maxParallel
) {

    public static final SchedulerConfig DEFAULTS = new SchedulerConfig(Duration.ofSeconds(300), 2, 50, 3);

    public SchedulerConfig {
        if (perTaskTimeout == null || perTaskTimeout.isNegative() || perTaskTimeout.isZero()) {
            throw new IllegalArgumentException("perTaskTimeout must be positive");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (maxTotalIterations < 1) {
            throw new IllegalArgumentException("maxTotalIterations must be >= 1");
        }
        if (maxParallel < 1) {
            throw new IllegalArgumentException("maxParallel must be >= 1");
        }
    }

    public SchedulerConfig withMaxRetries(int retries) {
        return new SchedulerConfig(perTaskTimeout, retries, maxTotalIterations, maxParallel);
    }

    public SchedulerConfig withPerTaskTimeout(Duration timeout) {
        return new SchedulerConfig(timeout, maxRetries, maxTotalIterations, maxParallel);
    }

    public SchedulerConfig withMaxTotalIterations(int iterations) {
        return new SchedulerConfig(perTaskTimeout, maxRetries, iterations, maxParallel);
    }

    public SchedulerConfig withMaxParallel(int parallel) {
        return new SchedulerConfig(perTaskTimeout, maxRetries, maxTotalIterations, parallel);
    }
}
