package io.easel.core;

/**
 * How a batch of independent units reacts to individual failures.
 */
public enum FailurePolicy {
    /** First failure or timeout aborts the whole call; no partial results. */
    FAIL_FAST,
    /** Every unit runs to its own end; only successful values are returned. */
    BEST_EFFORT
}
