package io.easel.server.validation;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings of {@link ResourceValidator}.
 *
 * @param probeTimeout          bound on one probe attempt
 * @param cacheTimeout          lifetime of a cached verdict (valid or not)
 * @param batchSize             URLs validated concurrently per batch
 * @param retries               extra attempts after a transport failure
 * @param backoffBase           sleep before retry n is backoffBase * n
 * @param maxConcurrency        probes in flight at once, across all callers
 * @param taskTimeout           bound on one URL's whole check, retries included
 * @param cacheMaxEntries       capacity of the validation cache
 * @param expectedContentPrefix Content-Type prefix a live resource must carry
 */
public record ValidatorConfig(
        Duration probeTimeout,
        Duration cacheTimeout,
        int batchSize,
        int retries,
        Duration backoffBase,
        int maxConcurrency,
        Duration taskTimeout,
        int cacheMaxEntries,
        String expectedContentPrefix
) {

    public ValidatorConfig {
        requirePositive(probeTimeout, "probeTimeout");
        requirePositive(cacheTimeout, "cacheTimeout");
        requirePositive(taskTimeout, "taskTimeout");
        Objects.requireNonNull(backoffBase, "backoffBase");
        if (backoffBase.isNegative()) {
            throw new IllegalArgumentException("backoffBase must be >= 0, got: " + backoffBase);
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0, got: " + batchSize);
        }
        if (retries < 0) {
            throw new IllegalArgumentException("retries must be >= 0, got: " + retries);
        }
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be > 0, got: " + maxConcurrency);
        }
        if (cacheMaxEntries <= 0) {
            throw new IllegalArgumentException("cacheMaxEntries must be > 0, got: " + cacheMaxEntries);
        }
        Objects.requireNonNull(expectedContentPrefix, "expectedContentPrefix");
    }

    /** 5s probes, 5 min cache, batches of 10, 2 retries at 1s/2s, image/* only. */
    public static ValidatorConfig defaults() {
        return new ValidatorConfig(
                Duration.ofSeconds(5),
                Duration.ofMinutes(5),
                10,
                2,
                Duration.ofSeconds(1),
                10,
                Duration.ofSeconds(30),
                10_000,
                "image/"
        );
    }

    public ValidatorConfig withRetries(int retries) {
        return new ValidatorConfig(probeTimeout, cacheTimeout, batchSize, retries, backoffBase,
                maxConcurrency, taskTimeout, cacheMaxEntries, expectedContentPrefix);
    }

    public ValidatorConfig withBatchSize(int batchSize) {
        return new ValidatorConfig(probeTimeout, cacheTimeout, batchSize, retries, backoffBase,
                maxConcurrency, taskTimeout, cacheMaxEntries, expectedContentPrefix);
    }

    public ValidatorConfig withTaskTimeout(Duration taskTimeout) {
        return new ValidatorConfig(probeTimeout, cacheTimeout, batchSize, retries, backoffBase,
                maxConcurrency, taskTimeout, cacheMaxEntries, expectedContentPrefix);
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be > 0, got: " + d);
        }
    }
}
