package io.easel.core;

/** A unit's own operation threw; the original exception is the cause. */
public final class TaskFailureException extends RuntimeException {

    public TaskFailureException(Throwable cause) {
        super("task failed: " + cause, cause);
    }
}
