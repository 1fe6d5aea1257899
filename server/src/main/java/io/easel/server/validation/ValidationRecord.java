package io.easel.server.validation;

import java.time.Instant;
import java.util.Objects;

/**
 * Cached verdict for one resource URL.
 */
public record ValidationRecord(String resourceKey, boolean valid, Instant checkedAt) {

    public ValidationRecord {
        Objects.requireNonNull(resourceKey, "resourceKey");
        Objects.requireNonNull(checkedAt, "checkedAt");
    }
}
