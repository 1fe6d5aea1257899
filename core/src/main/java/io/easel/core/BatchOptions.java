package io.easel.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Flush triggers for a batch group.
 *
 * @param maxSize size trigger: the group flushes as soon as it holds this many items (must be > 0)
 * @param maxWait time trigger: the group flushes this long after its first item (must be > 0)
 */
public record BatchOptions(int maxSize, Duration maxWait) {

    public static final int DEFAULT_MAX_SIZE = 10;
    public static final Duration DEFAULT_MAX_WAIT = Duration.ofMillis(100);

    public BatchOptions {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0, got: " + maxSize);
        }
        Objects.requireNonNull(maxWait, "maxWait");
        if (maxWait.isZero() || maxWait.isNegative()) {
            throw new IllegalArgumentException("maxWait must be > 0, got: " + maxWait);
        }
    }

    public static BatchOptions defaults() {
        return new BatchOptions(DEFAULT_MAX_SIZE, DEFAULT_MAX_WAIT);
    }
}
