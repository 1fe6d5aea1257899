package io.easel.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings for one {@link ParallelTaskRunner} call.
 *
 * @param maxConcurrency  maximum number of units holding a permit at once (must be > 0)
 * @param perTaskTimeout  time a unit may run after acquiring its permit (must be > 0)
 * @param failurePolicy   FAIL_FAST or BEST_EFFORT
 */
public record RunnerConfig(
        int maxConcurrency,
        Duration perTaskTimeout,
        FailurePolicy failurePolicy
) {

    public static final int DEFAULT_MAX_CONCURRENCY = 10;
    public static final Duration DEFAULT_TASK_TIMEOUT = Duration.ofSeconds(30);

    public RunnerConfig {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be > 0, got: " + maxConcurrency);
        }
        Objects.requireNonNull(perTaskTimeout, "perTaskTimeout");
        if (perTaskTimeout.isZero() || perTaskTimeout.isNegative()) {
            throw new IllegalArgumentException("perTaskTimeout must be > 0, got: " + perTaskTimeout);
        }
        Objects.requireNonNull(failurePolicy, "failurePolicy");
    }

    /** 10 concurrent units, 30s per unit, best-effort. */
    public static RunnerConfig defaults() {
        return new RunnerConfig(DEFAULT_MAX_CONCURRENCY, DEFAULT_TASK_TIMEOUT, FailurePolicy.BEST_EFFORT);
    }

    public RunnerConfig withMaxConcurrency(int maxConcurrency) {
        return new RunnerConfig(maxConcurrency, perTaskTimeout, failurePolicy);
    }

    public RunnerConfig withPerTaskTimeout(Duration perTaskTimeout) {
        return new RunnerConfig(maxConcurrency, perTaskTimeout, failurePolicy);
    }

    public RunnerConfig withFailurePolicy(FailurePolicy failurePolicy) {
        return new RunnerConfig(maxConcurrency, perTaskTimeout, failurePolicy);
    }
}
