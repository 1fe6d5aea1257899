package io.easel.core;

import java.time.Duration;

/** A unit exceeded its per-task timeout. */
public final class TaskTimeoutException extends RuntimeException {

    private final Duration timeout;

    public TaskTimeoutException(Duration timeout) {
        super("task timed out after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
