package io.easel.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of a single unit run by {@link ParallelTaskRunner#settle}.
 *
 * Exactly one of:
 *  - Completed: the unit returned a value (possibly null),
 *  - Failed:    the unit threw; {@code error} is the unit's own exception,
 *  - TimedOut:  the unit did not finish within its per-task timeout.
 */
public sealed interface TaskOutcome<T>
        permits TaskOutcome.Completed, TaskOutcome.Failed, TaskOutcome.TimedOut {

    record Completed<T>(T value) implements TaskOutcome<T> {}

    record Failed<T>(Throwable error) implements TaskOutcome<T> {
        public Failed {
            Objects.requireNonNull(error, "error");
        }
    }

    record TimedOut<T>(Duration timeout) implements TaskOutcome<T> {}

    default boolean isCompleted() {
        return this instanceof Completed;
    }

    static <T> TaskOutcome<T> completed(T value) {
        return new Completed<>(value);
    }

    static <T> TaskOutcome<T> failed(Throwable error) {
        return new Failed<>(error);
    }

    static <T> TaskOutcome<T> timedOut(Duration timeout) {
        return new TimedOut<>(timeout);
    }
}
